package com.linlay.agentroom.security;

public class InputValidationException extends IllegalArgumentException {

    public InputValidationException(String message) {
        super(message);
    }
}
