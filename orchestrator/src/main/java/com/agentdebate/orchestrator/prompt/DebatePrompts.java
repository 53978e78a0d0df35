package com.agentdebate.orchestrator.prompt;

import com.agentdebate.orchestrator.model.DebateTopic;

/**
 * Prompt text for each stage of a debate.
 *
 * Every prompt embeds the topic. Later stages also embed the earlier
 * responses verbatim between "---" delimiters: no truncation, escaping or
 * summarising, so a prior response is always an exact substring of the
 * prompt that follows it.
 *
 * Pure functions only (no I/O, no state).
 */
public final class DebatePrompts {

    private DebatePrompts() {}

    // ------------------------------------------------------------------
    // Stage prompts
    // ------------------------------------------------------------------

    public static String forPrompt(DebateTopic topic) {
        return FOR_TEMPLATE.formatted(topic.title(), topic.description());
    }

    public static String againstPrompt(DebateTopic topic, String forResponse) {
        return AGAINST_TEMPLATE.formatted(topic.title(), topic.description(), nullToEmpty(forResponse));
    }

    public static String synthesisPrompt(DebateTopic topic, String forResponse, String againstResponse) {
        return SYNTHESIS_TEMPLATE.formatted(topic.title(), topic.description(),
                nullToEmpty(forResponse), nullToEmpty(againstResponse));
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    // ------------------------------------------------------------------
    // Templates  (%s slots are filled with String.formatted, which never
    // re-interprets the inserted text)
    // ------------------------------------------------------------------

    private static final String FOR_TEMPLATE = """
            You are arguing in favor of the following topic:

            Topic: %s
            Description: %s

            Provide a clear, compelling argument in favor of this topic.
            Be specific and evidence-based.
            Keep your response focused and substantive.""";

    private static final String AGAINST_TEMPLATE = """
            You are arguing against the following topic:

            Topic: %s
            Description: %s

            The argument in favor of this topic was:
            ---
            %s
            ---

            Provide a clear, compelling counter-argument against this topic.
            Address the points made in the FOR argument.
            Be specific and evidence-based.
            Keep your response focused and substantive.""";

    private static final String SYNTHESIS_TEMPLATE = """
            You are synthesizing a debate on the following topic:

            Topic: %s
            Description: %s

            ARGUMENT IN FAVOR:
            ---
            %s
            ---

            ARGUMENT AGAINST:
            ---
            %s
            ---

            Provide a balanced synthesis that:
            1. Acknowledges the strengths of both arguments
            2. Identifies the weaknesses in both arguments
            3. Synthesizes a nuanced perspective that considers both viewpoints
            4. Offers insights on how to resolve the tensions between the two positions

            Keep your synthesis thoughtful and balanced.""";
}
