package com.di.pgproof.exception;

/**
 * Sandbox namespace could not be created or a measured statement failed.
 */
public class SandboxException extends RuntimeException {

    public SandboxException(String message, Throwable cause) {
        super(message, cause);
    }
}
