package com.github.anirbanmu.discorder.config;

import java.util.Map;
import java.util.function.Supplier;

public final class Credentials {
    public static final String TOKEN_ENV = "DISCORD_BOT_TOKEN";

    private Credentials() {
    }

    // token lookup is deferred to identify time so a missing token surfaces there
    public static Supplier<String> fromEnvironment() {
        return () -> resolveToken(System.getenv());
    }

    public static String resolveToken(Map<String, String> env) {
        String token = env.get(TOKEN_ENV);
        if (token == null || token.isBlank()) {
            throw new MissingCredentialsException("Please define " + TOKEN_ENV + " environment variable.");
        }
        return token.trim();
    }
}
