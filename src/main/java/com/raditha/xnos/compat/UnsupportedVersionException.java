package com.raditha.xnos.compat;

/**
 * Thrown for a pandoc version that cannot be parsed or falls outside the
 * supported range.
 */
public class UnsupportedVersionException extends IllegalArgumentException {

    public UnsupportedVersionException(String message) {
        super(message);
    }
}
