package com.expertpanel.common.exception;

/** Ways a generation call can fail before its text is usable. */
public enum GenerationFailure {
    TIMEOUT,
    EMPTY,
    TRUNCATED,
    BACKEND_ERROR,
    PARSE_FAILURE
}
