package org.dxworks.mesonactions;

/**
 * Thrown before traversal when a code action request cannot be served at all.
 */
public class InvalidCodeActionRequestException extends IllegalArgumentException {

    public InvalidCodeActionRequestException(String message) {
        super("Invalid code action request: " + message);
    }
}
