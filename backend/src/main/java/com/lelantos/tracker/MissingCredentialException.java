package com.lelantos.tracker;

/**
 * No tracker API key was supplied by the caller.
 */
public class MissingCredentialException extends RuntimeException {

    public MissingCredentialException() {
        super("A SolanaTracker API key is required (x-api-key header)");
    }
}
