package com.logs.anomaly.exception;

/**
 * Failure categories of the analysis pipeline.
 * Only INPUT_MISSING and DATA_FORMAT describe caller data and may be reported verbatim.
 */
public enum ErrorKind {
    INPUT_MISSING,
    DATA_FORMAT,
    MODEL_NOT_FITTED
}
