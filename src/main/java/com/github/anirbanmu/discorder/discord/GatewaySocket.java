package com.github.anirbanmu.discorder.discord;

import java.io.IOException;
import java.time.Duration;

// framed bidirectional text connection to the gateway
public interface GatewaySocket extends AutoCloseable {

    // blocks for the next complete frame. returns "" once the connection is gone.
    String read() throws InterruptedException;

    // like read(), but null if nothing arrived within the timeout
    String read(Duration timeout) throws InterruptedException;

    void send(String frame) throws IOException;

    boolean isOpen();

    // idempotent. unblocks a pending read.
    @Override
    void close();
}
