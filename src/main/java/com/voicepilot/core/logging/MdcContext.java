package com.voicepilot.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing VoicePilot MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String UTTERANCE_ID = "utteranceId";
    public static final String STEP_INDEX = "stepIndex";
    public static final String INTENT = "intent";

    private MdcContext() {}

    public static void setUtterance(String utteranceId) {
        MDC.put(UTTERANCE_ID, utteranceId);
    }

    public static void setStep(String utteranceId, int stepIndex, String intent) {
        MDC.put(UTTERANCE_ID, utteranceId);
        MDC.put(STEP_INDEX, String.valueOf(stepIndex));
        MDC.put(INTENT, intent);
    }

    public static void clearStep() {
        MDC.remove(STEP_INDEX);
        MDC.remove(INTENT);
    }

    public static void clear() {
        MDC.remove(UTTERANCE_ID);
        MDC.remove(STEP_INDEX);
        MDC.remove(INTENT);
    }
}
