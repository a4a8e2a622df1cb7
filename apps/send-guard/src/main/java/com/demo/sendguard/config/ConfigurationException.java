package com.demo.sendguard.config;

/**
 * Invalid send-guard configuration. Raised while a handler is being built, never per message.
 */
public class ConfigurationException extends RuntimeException {

    private final String field;

    public ConfigurationException(String field, String message) {
        super(message);
        this.field = field;
    }

    /** Name of the first setting that violated its constraint. */
    public String getField() {
        return field;
    }
}
