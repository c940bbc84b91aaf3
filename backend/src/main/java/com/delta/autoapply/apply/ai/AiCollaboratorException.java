package com.delta.autoapply.apply.ai;

public class AiCollaboratorException extends Exception {
    public AiCollaboratorException(String message) {
        super(message);
    }

    public AiCollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
