package com.partassist.corpus;

public class CorpusLoadException extends Exception {
    private static final long serialVersionUID = 1L;

    public CorpusLoadException(String message) {
        super(message);
    }

    public CorpusLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
