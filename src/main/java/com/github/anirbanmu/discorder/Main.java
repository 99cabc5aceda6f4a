package com.github.anirbanmu.discorder;

import com.github.anirbanmu.discorder.config.ConfigLoader;
import com.github.anirbanmu.discorder.config.Credentials;
import com.github.anirbanmu.discorder.config.DiscorderConfig;
import com.github.anirbanmu.discorder.config.MissingCredentialsException;
import com.github.anirbanmu.discorder.discord.ControlPlane;
import com.github.anirbanmu.discorder.discord.DiscordHttpClient;
import com.github.anirbanmu.discorder.discord.SessionTracker;
import com.github.anirbanmu.discorder.discord.WebSocketGatewaySocket;
import com.github.anirbanmu.discorder.discord.json.GatewayEvent;
import com.github.anirbanmu.discorder.log.Log;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

public class Main {
    private static final Duration POLL = Duration.ofSeconds(1);

    public static void main(String[] args) {
        Path configPath = Path.of(System.getProperty("config", "discorder.toml"));

        DiscorderConfig config;
        try {
            config = ConfigLoader.load(configPath);
        } catch (Exception e) {
            Log.error("startup.config_error", e, "path", configPath.toAbsolutePath().toString());
            System.exit(1);
            return;
        }
        Log.setLevel(config.logLevel());
        Log.info("startup.config_loaded", "path", configPath.toAbsolutePath().toString(),
            "api_version", config.gateway().apiVersion(), "intents", config.gateway().intents());

        ControlPlane controlPlane = new ControlPlane(
            config,
            new DiscordHttpClient(),
            WebSocketGatewaySocket::connect,
            Credentials.fromEnvironment());

        AtomicReference<Throwable> loopFailure = new AtomicReference<>();
        Thread loop = new Thread(() -> {
            try {
                controlPlane.run();
            } catch (MissingCredentialsException e) {
                Log.error("startup.missing_token", "message", e.getMessage());
                loopFailure.set(e);
            }
        }, "control-plane-loop");
        loop.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            Log.info("shutdown.requested");
            controlPlane.shutdown();
        }, "shutdown-hook"));

        try {
            consume(controlPlane, loop);
            loop.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        if (loopFailure.get() != null) {
            System.exit(1);
        }
    }

    // follows the control plane from attempt to attempt; every attempt has its own queue
    private static void consume(ControlPlane controlPlane, Thread loop) throws InterruptedException {
        SessionTracker tracker = null;
        while (loop.isAlive()) {
            SessionTracker latest = controlPlane.current();
            if (latest != tracker && (tracker == null || tracker.isDrained())) {
                tracker = latest;
            }
            if (tracker == null) {
                Thread.sleep(POLL.toMillis());
                continue;
            }
            Optional<GatewayEvent> event = tracker.nextEvent(POLL);
            if (event.isPresent()) {
                GatewayEvent e = event.get();
                Log.info("event.received", "attempt", tracker.attempt(), "name", e.name(),
                    "type", e.payload() == null ? "none" : e.payload().getClass().getSimpleName());
            }
        }
    }
}
