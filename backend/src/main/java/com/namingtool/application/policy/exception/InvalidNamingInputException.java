package com.namingtool.application.policy.exception;

public class InvalidNamingInputException extends RuntimeException {

    public InvalidNamingInputException(String message) {
        super(message);
    }
}
