package com.example.cortex.service.exception;

import org.springframework.http.HttpStatus;

public class UserNotFoundException extends CortexException {

    private final String userId;

    public UserNotFoundException(String userId) {
        super(HttpStatus.NOT_FOUND, "User not found: " + userId, "user_not_found");
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
