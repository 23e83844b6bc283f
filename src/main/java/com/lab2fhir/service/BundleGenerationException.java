package com.lab2fhir.service;

public class BundleGenerationException extends PipelineException {

    public BundleGenerationException(String message) {
        super(ErrorCode.BUNDLE_GENERATION_FAILED, message);
    }

    public BundleGenerationException(String message, Throwable cause) {
        super(ErrorCode.BUNDLE_GENERATION_FAILED, message, null, cause);
    }
}
