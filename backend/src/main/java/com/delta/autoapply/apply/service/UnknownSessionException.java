package com.delta.autoapply.apply.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class UnknownSessionException extends RuntimeException {
    public UnknownSessionException(UUID sessionId) {
        super("Unknown application session " + sessionId);
    }
}
