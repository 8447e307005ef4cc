package com.enterprise.autosave.exception;

/**
 * Base exception for download scheduling related errors
 */
public class AutoSaveException extends Exception {
    
    public AutoSaveException(String message) {
        super(message);
    }
    
    public AutoSaveException(String message, Throwable cause) {
        super(message, cause);
    }
}
