package com.notionexport.core.exception;

/** Base exception for failures that abort or degrade an export run. */
public class ExportException extends RuntimeException {

    public ExportException(String message) {
        super(message);
    }

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
