package com.example.cortex.service.exception;

import org.springframework.http.HttpStatus;

public class CortexException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public CortexException(HttpStatus status, String message) {
        this(status, message, null, null);
    }

    public CortexException(HttpStatus status, String message, String errorCode) {
        this(status, message, errorCode, null);
    }

    public CortexException(HttpStatus status, String message, String errorCode, Throwable cause) {
        super(message, cause, false, status.is5xxServerError());
        this.status = status;
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
