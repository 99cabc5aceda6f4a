package com.github.anirbanmu.discorder.discord;

import com.github.anirbanmu.discorder.log.Log;
import com.github.anirbanmu.discorder.util.Http;
import java.io.IOException;
import java.net.URI;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

// java.net.http websocket as a blocking frame source. listener callbacks push complete
// text frames onto a queue; closing pushes an empty frame so readers wake up.
public final class WebSocketGatewaySocket implements GatewaySocket {
    private static final String CLOSED = "";

    private final BlockingQueue<String> frames = new LinkedBlockingQueue<>();
    private final AtomicBoolean open = new AtomicBoolean(true);
    private final StringBuilder messageBuffer = new StringBuilder();
    private volatile WebSocket socket;

    private WebSocketGatewaySocket() {
    }

    // blocks until the websocket handshake completes
    public static WebSocketGatewaySocket connect(String url) throws IOException {
        WebSocketGatewaySocket gs = new WebSocketGatewaySocket();
        try {
            gs.socket = Http.CLIENT.newWebSocketBuilder()
                .buildAsync(URI.create(url), gs.new Listener())
                .join();
        } catch (CompletionException ex) {
            throw new IOException("Unable to open websocket to " + url, ex.getCause());
        }
        return gs;
    }

    @Override
    public String read() throws InterruptedException {
        if (!open.get() && frames.isEmpty()) {
            return CLOSED;
        }
        return frames.take();
    }

    @Override
    public String read(Duration timeout) throws InterruptedException {
        if (!open.get() && frames.isEmpty()) {
            return CLOSED;
        }
        return frames.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    @Override
    public synchronized void send(String frame) throws IOException {
        WebSocket ws = socket;
        if (ws == null || !isOpen()) {
            throw new IOException("websocket is closed");
        }
        try {
            ws.sendText(frame, true).join();
        } catch (CompletionException ex) {
            throw new IOException("websocket send failed", ex.getCause());
        }
    }

    @Override
    public boolean isOpen() {
        WebSocket ws = socket;
        return open.get() && ws != null && !ws.isInputClosed() && !ws.isOutputClosed();
    }

    @Override
    public void close() {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        WebSocket ws = socket;
        if (ws != null && !ws.isOutputClosed()) {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "closing")
                .exceptionally(ex -> {
                    Log.debug("websocket.close_failed", "err", ex.getMessage());
                    ws.abort();
                    return null;
                });
        }
        frames.offer(CLOSED);
    }

    private void markClosed() {
        if (open.compareAndSet(true, false)) {
            frames.offer(CLOSED);
        }
    }

    private class Listener implements WebSocket.Listener {
        @Override
        public void onOpen(WebSocket webSocket) {
            Log.info("websocket.connected");
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            messageBuffer.append(data);
            if (last) {
                frames.offer(messageBuffer.toString());
                messageBuffer.setLength(0);
                messageBuffer.trimToSize();
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            Log.info("websocket.closed", "code", statusCode, "reason", reason);
            markClosed();
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            Log.error("websocket.error", error);
            markClosed();
        }
    }
}
