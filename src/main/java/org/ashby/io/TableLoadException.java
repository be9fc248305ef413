package org.ashby.io;

/**
 * Thrown when an input can be read but does not describe a usable material table.
 */
public class TableLoadException extends RuntimeException {

    public TableLoadException(String message) {
        super(message);
    }

    public TableLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
