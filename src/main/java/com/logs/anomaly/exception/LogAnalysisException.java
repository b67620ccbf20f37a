package com.logs.anomaly.exception;

public abstract class LogAnalysisException extends RuntimeException {

    private final ErrorKind kind;

    protected LogAnalysisException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected LogAnalysisException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
