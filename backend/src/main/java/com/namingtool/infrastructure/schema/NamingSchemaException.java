package com.namingtool.infrastructure.schema;

public class NamingSchemaException extends RuntimeException {

    public NamingSchemaException(String message) {
        super(message);
    }
}
