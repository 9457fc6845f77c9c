package com.partassist.chat;

public record ResetAcknowledgement(String sessionId, String status) {

    public static ResetAcknowledgement reset(String sessionId) {
        return new ResetAcknowledgement(sessionId, "reset");
    }
}
