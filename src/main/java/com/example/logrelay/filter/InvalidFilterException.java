package com.example.logrelay.filter;

/**
 * A filter value that cannot be applied. Raised before any state changes.
 */
public class InvalidFilterException extends IllegalArgumentException {
    public InvalidFilterException(String message) {
        super(message);
    }
}
