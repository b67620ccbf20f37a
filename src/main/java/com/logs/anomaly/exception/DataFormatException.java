package com.logs.anomaly.exception;

/**
 * Raised during feature derivation when the batch cannot be turned into a numeric matrix:
 * an unparseable timestamp or a numeric column with missing values.
 */
public class DataFormatException extends LogAnalysisException {

    public DataFormatException(String message) {
        super(ErrorKind.DATA_FORMAT, message);
    }

    public DataFormatException(String message, Throwable cause) {
        super(ErrorKind.DATA_FORMAT, message, cause);
    }
}
