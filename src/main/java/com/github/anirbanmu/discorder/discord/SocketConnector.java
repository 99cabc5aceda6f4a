package com.github.anirbanmu.discorder.discord;

import java.io.IOException;

@FunctionalInterface
public interface SocketConnector {
    GatewaySocket connect(String url) throws IOException;
}
