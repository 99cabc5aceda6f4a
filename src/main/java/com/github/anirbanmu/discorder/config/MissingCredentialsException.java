package com.github.anirbanmu.discorder.config;

// configuration error, never a transient gateway fault. the supervise loop does not retry it.
public class MissingCredentialsException extends RuntimeException {
    public MissingCredentialsException(String message) {
        super(message);
    }
}
