package com.logs.anomaly.exception;

public class InputMissingException extends LogAnalysisException {

    public static final String MESSAGE = "No log data provided";

    public InputMissingException() {
        super(ErrorKind.INPUT_MISSING, MESSAGE);
    }
}
