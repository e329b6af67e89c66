package org.catalogregistry.registry;

/**
 * The command line could not be understood.
 */
public class UsageException extends Exception {
    public UsageException(String message) {
        super(message);
    }
}
