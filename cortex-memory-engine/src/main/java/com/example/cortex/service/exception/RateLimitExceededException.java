package com.example.cortex.service.exception;

import com.example.cortex.domain.OperationClass;
import com.example.cortex.domain.RateLimitStatus;
import org.springframework.http.HttpStatus;

public class RateLimitExceededException extends CortexException {

    private final OperationClass operationClass;
    private final RateLimitStatus rateLimitStatus;

    public RateLimitExceededException(OperationClass operationClass, RateLimitStatus rateLimitStatus) {
        super(
                HttpStatus.TOO_MANY_REQUESTS,
                "Rate limit exceeded. Retry after %d seconds.".formatted(rateLimitStatus.retryAfterSeconds()),
                "rate_limit_exceeded");
        this.operationClass = operationClass;
        this.rateLimitStatus = rateLimitStatus;
    }

    public OperationClass getOperationClass() {
        return operationClass;
    }

    public RateLimitStatus getRateLimitStatus() {
        return rateLimitStatus;
    }
}
