package com.keystone.utilities.serialization;

/**
 * Thrown when a value cannot be written to or read from JSON.
 */
public class SerializationException extends RuntimeException {

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
