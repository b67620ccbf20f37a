package com.logs.anomaly.exception;

public class ModelNotFittedException extends LogAnalysisException {

    public ModelNotFittedException() {
        super(ErrorKind.MODEL_NOT_FITTED, "Model has not been fitted yet.");
    }
}
