package io.expandcheck.unit;

import java.io.IOException;

/**
 * A unit description file is malformed.
 */
public class UnitFormatException extends IOException {

    public UnitFormatException(String message) {
        super(message);
    }

    public UnitFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
