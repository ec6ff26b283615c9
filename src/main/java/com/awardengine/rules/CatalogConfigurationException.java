package com.awardengine.rules;

/**
 * Thrown when an award catalog is malformed: blank or duplicate keys, missing
 * conditions, or a condition reading a metric as the wrong kind.
 */
public class CatalogConfigurationException extends RuntimeException {

    public CatalogConfigurationException(String message) {
        super(message);
    }
}
