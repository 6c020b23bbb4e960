package com.traceforge.database.json;

/** Thrown when a JSON column value cannot be read or written. */
public class JsonColumnException extends RuntimeException {

    public JsonColumnException(String message, Throwable cause) {
        super(message, cause);
    }
}
