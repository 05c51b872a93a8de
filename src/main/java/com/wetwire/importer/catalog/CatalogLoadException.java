package com.wetwire.importer.catalog;

/**
 * Thrown when a type catalog document cannot be read.
 */
public class CatalogLoadException extends RuntimeException {

    public CatalogLoadException(String message) {
        super(message);
    }

    public CatalogLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
