package com.delta.autoapply.apply.flow;

public class ApplicationCancelledException extends RuntimeException {
    public ApplicationCancelledException(String message) {
        super(message);
    }
}
