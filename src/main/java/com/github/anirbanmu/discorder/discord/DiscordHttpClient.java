package com.github.anirbanmu.discorder.discord;

import com.github.anirbanmu.discorder.discord.json.GatewayInfo;
import com.github.anirbanmu.discorder.log.Log;
import com.github.anirbanmu.discorder.util.Http;
import com.github.anirbanmu.discorder.util.Json;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

// the one REST call the gateway needs: where to connect
public class DiscordHttpClient implements GatewayUrlResolver {
    private static final String BASE_URL = "https://discord.com/api/v10";
    private static final Duration REQUEST_TIMEOUT = Duration.ofMillis(2500);

    private final String baseUrl;

    public DiscordHttpClient() {
        this(BASE_URL);
    }

    public DiscordHttpClient(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    // https://discord.com/developers/docs/topics/gateway#get-gateway
    public DiscordResult<GatewayInfo> getGateway() {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/gateway"))
            .timeout(REQUEST_TIMEOUT)
            .GET()
            .build();

        try {
            HttpResponse<byte[]> response = Http.CLIENT.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() >= 400) {
                Log.error("http.request_failed", "path", "/gateway", "status", response.statusCode());
                return new DiscordResult.Failure<>("Discord API error", response.statusCode());
            }
            byte[] body = response.body();
            GatewayInfo info = Json.DSL.deserialize(GatewayInfo.class, body, body.length);
            if (info == null || info.url() == null) {
                return new DiscordResult.Failure<>("Gateway response has no url", response.statusCode());
            }
            return new DiscordResult.Success<>(info);
        } catch (IOException e) {
            return new DiscordResult.Failure<>("HTTP request failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new DiscordResult.Failure<>("HTTP request interrupted", e);
        }
    }

    @Override
    public String resolveGatewayUrl() throws IOException {
        DiscordResult<GatewayInfo> result = getGateway();
        if (result instanceof DiscordResult.Success<GatewayInfo> success) {
            return success.value().url();
        }
        DiscordResult.Failure<GatewayInfo> f = (DiscordResult.Failure<GatewayInfo>) result;
        if (f.exception() != null) {
            throw new IOException("Unable to look up gateway url: " + f.message(), f.exception());
        }
        throw new IOException("Unable to look up gateway url: " + f.message() + " (status " + f.statusCode() + ")");
    }
}
