package com.voicepilot.core.llm;

/**
 * Why a generative parse produced no command.
 */
public enum FailureKind {
    /** The service did not answer within the request timeout. */
    TIMEOUT,
    /** The service call failed or returned nothing. */
    SERVICE_ERROR,
    /** The output was JSON but did not satisfy the command schema. */
    VALIDATION_ERROR,
    /** The output contained no parseable JSON object. */
    PARSE_ERROR
}
