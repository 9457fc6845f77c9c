package com.partassist.provider;

public enum FailureReason {
    TIMEOUT,
    UNREACHABLE,
    RATE_LIMITED,
    MALFORMED_RESPONSE,
    AUTH_REJECTED
}
