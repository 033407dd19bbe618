package com.raditha.ompx.frontend;

import java.io.IOException;

/**
 * Thrown when a serialized syntax tree cannot be turned into nodes.
 */
public class TreeFormatException extends IOException {

    public TreeFormatException(String message) {
        super(message);
    }

    public TreeFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
