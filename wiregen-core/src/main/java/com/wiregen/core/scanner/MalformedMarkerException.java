package com.wiregen.core.scanner;

/**
 * Thrown while reading a marker whose members cannot be interpreted. The extractor reports it
 * as a malformed-marker diagnostic and ignores the marker.
 */
public class MalformedMarkerException extends RuntimeException {

    public MalformedMarkerException(String message) {
        super(message);
    }
}
