package com.github.anirbanmu.discorder.discord;

import java.io.IOException;

// base websocket url, without query string
@FunctionalInterface
public interface GatewayUrlResolver {
    String resolveGatewayUrl() throws IOException;
}
