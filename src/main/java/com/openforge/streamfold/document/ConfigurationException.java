package com.openforge.streamfold.document;

/**
 * A required setting is missing.  Raised at construction time, before any
 * connection is opened.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
