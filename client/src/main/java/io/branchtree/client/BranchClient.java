// file: client/src/main/java/io/branchtree/client/BranchClient.java
package io.branchtree.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Minimal HTTP client for a running branch-tree server. Every call is a
 * JSON POST; any non-200 answer becomes a {@link ClientException} carrying
 * the status and the server's error body.
 */
public final class BranchClient {

    private final HttpClient http;
    private final ObjectMapper json;
    private final String baseUrl;

    public BranchClient(String baseUrl, ObjectMapper json) {
        this.http = HttpClient.newHttpClient();
        this.json = json;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public JsonNode post(String path, JsonNode body) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(json.writeValueAsBytes(body)))
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new ClientException(resp.statusCode(), resp.body());
        }
        return json.readTree(resp.body());
    }

    public static final class ClientException extends RuntimeException {
        private final int status;

        ClientException(int status, String body) {
            super("request failed (" + status + "): " + body);
            this.status = status;
        }

        public int status() { return status; }
    }
}
