package com.cloudferry.orchestrator.handler;

/**
 * No handler is registered for a discriminator that a Job carries.
 * This is a deployment fault, not a user error.
 */
public class HandlerNotFoundException extends RuntimeException {
    public HandlerNotFoundException(String axis, Enum<?> key) {
        super("No " + axis + " registered for: '" + key + "'");
    }
}
