package com.partassist.dispatch;

public enum AnswerSource {
    PROVIDER("provider"),
    TRAINING_DATA("training-data"),
    GENERIC_FALLBACK("generic-fallback");

    private final String tag;

    AnswerSource(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
