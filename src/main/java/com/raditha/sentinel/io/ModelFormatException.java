package com.raditha.sentinel.io;

import java.io.IOException;

/**
 * The analysis model export is readable JSON but does not describe a valid model.
 */
public class ModelFormatException extends IOException {

    public ModelFormatException(String message) {
        super(message);
    }

    public ModelFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
