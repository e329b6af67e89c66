package org.catalogregistry.csw.reader;

/**
 * A CSW document could not be read, or the service answered with an exception report.
 */
public class CswParseException extends Exception {
    public CswParseException(String message) {
        super(message);
    }

    public CswParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
