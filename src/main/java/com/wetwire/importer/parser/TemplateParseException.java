package com.wetwire.importer.parser;

/**
 * Thrown when input cannot be decoded as a template at all.
 */
public class TemplateParseException extends RuntimeException {

    public TemplateParseException(String message) {
        super(message);
    }

    public TemplateParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
