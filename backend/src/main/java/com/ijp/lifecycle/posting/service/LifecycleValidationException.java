package com.ijp.lifecycle.posting.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class LifecycleValidationException extends RuntimeException {
    public LifecycleValidationException(String message) {
        super(message);
    }
}
