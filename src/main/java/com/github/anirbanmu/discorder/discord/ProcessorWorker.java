package com.github.anirbanmu.discorder.discord;

import com.github.anirbanmu.discorder.discord.json.Envelope;
import com.github.anirbanmu.discorder.discord.json.GatewayEvent;
import com.github.anirbanmu.discorder.discord.json.PayloadCodec;
import com.github.anirbanmu.discorder.log.Log;

// reads frames, tracks the sequence number and publishes decoded events.
// publishing blocks when the queue is full, which stalls reading but never heartbeats.
final class ProcessorWorker implements Runnable {
    private final SessionTracker tracker;
    private final PayloadCodec codec;

    ProcessorWorker(SessionTracker tracker, PayloadCodec codec) {
        this.tracker = tracker;
        this.codec = codec;
    }

    @Override
    public void run() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                GatewaySocket socket = tracker.socket();
                if (!socket.isOpen()) {
                    Log.error("processor.socket_closed", "attempt", tracker.attempt());
                    return;
                }

                String frame = socket.read();
                if (frame.isEmpty()) {
                    Log.error("processor.empty_frame", "attempt", tracker.attempt());
                    return;
                }

                Log.debug("processor.received", "attempt", tracker.attempt(), "bytes", frame.length());
                handle(codec.decode(frame));
            }
            Log.info("processor.stopped", "attempt", tracker.attempt());
        } catch (InterruptedException ex) {
            Log.info("processor.stopped", "attempt", tracker.attempt());
        } catch (Exception ex) {
            Log.error("processor.error", ex, "attempt", tracker.attempt());
        }
    }

    void handle(Envelope envelope) throws InterruptedException {
        if (envelope.sequence() != null) {
            tracker.updateSequence(envelope.sequence());
        }

        switch (envelope.opcode()) {
            // https://discord.com/developers/docs/topics/gateway-events#resumed
            case RESUME -> publish(GatewayEvent.synthetic(GatewayEvent.RESUME));
            // https://discord.com/developers/docs/topics/gateway-events#reconnect
            case RECONNECT -> publish(GatewayEvent.synthetic(GatewayEvent.RECONNECT));
            // https://discord.com/developers/docs/topics/gateway-events#invalid-session
            case INVALID_SESSION -> publish(new GatewayEvent(GatewayEvent.INVALID_SESSION, envelope.data()));
            default -> {
                if (envelope.isDispatch()) {
                    dispatch(envelope);
                } else {
                    Log.debug("processor.ignored", "attempt", tracker.attempt(), "op", envelope.opcode());
                }
            }
        }
    }

    private void dispatch(Envelope envelope) throws InterruptedException {
        GatewayEvent event;
        try {
            event = codec.decodeEvent(envelope.eventName(), envelope.data());
        } catch (Exception ex) {
            Log.error("processor.decode_failed", ex, "attempt", tracker.attempt(), "event", envelope.eventName());
            return;
        }
        publish(event);
    }

    private void publish(GatewayEvent event) throws InterruptedException {
        tracker.events().put(event);
        Log.debug("processor.published", "attempt", tracker.attempt(), "event", event.name());
    }
}
