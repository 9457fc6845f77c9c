package com.partassist.provider;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;

final class HttpFailures {
    private HttpFailures() {
    }

    static FailureReason forStatus(int code) {
        if (code == 401 || code == 403) {
            return FailureReason.AUTH_REJECTED;
        }
        if (code == 429) {
            return FailureReason.RATE_LIMITED;
        }
        if (code == 408 || code == 504) {
            return FailureReason.TIMEOUT;
        }
        return FailureReason.UNREACHABLE;
    }

    static FailureReason forException(IOException e) {
        if (e instanceof SocketTimeoutException || e instanceof InterruptedIOException) {
            return FailureReason.TIMEOUT;
        }
        return FailureReason.UNREACHABLE;
    }
}
