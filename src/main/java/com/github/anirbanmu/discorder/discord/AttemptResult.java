package com.github.anirbanmu.discorder.discord;

// outcome of bringing up one attempt. Failed means no tracker was ever handed out.
public sealed interface AttemptResult {
    int attempt();

    record Started(SessionTracker tracker) implements AttemptResult {
        @Override
        public int attempt() {
            return tracker.attempt();
        }
    }

    record Failed(int attempt, Exception cause) implements AttemptResult {
    }
}
