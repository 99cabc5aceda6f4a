package com.github.anirbanmu.discorder.discord;

// handshake failure. fatal to one attempt, never to the process.
public class GatewayException extends Exception {
    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
