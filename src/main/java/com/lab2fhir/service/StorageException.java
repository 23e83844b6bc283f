package com.lab2fhir.service;

public class StorageException extends PipelineException {

    public StorageException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_ERROR, message, null, cause);
    }
}
