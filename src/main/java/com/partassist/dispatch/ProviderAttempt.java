package com.partassist.dispatch;

import com.partassist.provider.FailureReason;

public record ProviderAttempt(String provider, FailureReason reason, String detail, long elapsedMillis) {
}
