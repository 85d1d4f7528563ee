package com.raditha.xnos.attributes;

/**
 * No attribute block starts at the position that was scanned.
 */
public class AttributesNotFoundException extends Exception {

    public AttributesNotFoundException(String message) {
        super(message);
    }
}
