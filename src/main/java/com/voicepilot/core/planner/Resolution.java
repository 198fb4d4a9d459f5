package com.voicepilot.core.planner;

import com.voicepilot.core.llm.GenerationResult;
import com.voicepilot.core.model.ResolvedCommand;

/**
 * The resolved command for one utterance, and how it was obtained.
 *
 * @param utteranceId       correlation id, format {@code UTT-YYYY-NNNN}
 * @param text              the utterance as received
 * @param command           the resolved intent or plan
 * @param source            which strategy produced {@code command}
 * @param generativeFailure why generative parsing was not used (null when it succeeded or was disabled)
 */
public record Resolution(
    String utteranceId,
    String text,
    ResolvedCommand command,
    Source source,
    GenerationResult.Failure generativeFailure
) {

    public enum Source {
        GENERATIVE,
        RULES,
        SPLIT
    }
}
