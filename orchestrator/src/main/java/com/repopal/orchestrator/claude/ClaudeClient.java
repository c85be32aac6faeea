package com.repopal.orchestrator.claude;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repopal.orchestrator.capability.CapabilityException;
import com.repopal.orchestrator.config.RepoPalProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Anthropic Messages API over the JDK HttpClient.
 */
@Component
public class ClaudeClient {

    /**
     * A single message in a conversation.
     * role must be "user" or "assistant".
     */
    public record Message(String role, String content) {}

    /** The subset of the API response we care about. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Extracts the text from the first text block. */
        public String firstText() {
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No text block in response"));
        }
    }

    private static final String API_VER    = "2023-06-01";
    private static final int    MAX_TOKENS = 1024;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final RepoPalProperties.Claude config;

    public ClaudeClient(RepoPalProperties properties, ObjectMapper objectMapper) {
        this.config = properties.getClaude();
        this.json   = objectMapper;
        this.http   = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Send a single-turn conversation and return the assistant's text reply.
     *
     * @throws CapabilityException transient for 429/5xx and I/O failures, otherwise not
     */
    public String complete(String system, List<Message> messages) {
        try {
            String requestBody = json.writeValueAsString(Map.of(
                    "model",      config.getModel(),
                    "max_tokens", MAX_TOKENS,
                    "system",     system,
                    "messages",   messages
            ));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(config.getApiUrl()))
                    .timeout(Duration.ofSeconds(60))
                    .header("content-type",      "application/json")
                    .header("x-api-key",         config.getApiKey())
                    .header("anthropic-version", API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());

            int code = response.statusCode();
            if (code != 200) {
                boolean retryable = code == 429 || code == 529 || code >= 500;
                throw new CapabilityException("Claude API error %d: %s".formatted(code, response.body()), retryable);
            }

            return json.readValue(response.body(), MessagesResponse.class).firstText();

        } catch (CapabilityException e) {
            throw e;
        } catch (IOException e) {
            throw new CapabilityException("Claude API call failed: " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CapabilityException("Interrupted while calling Claude", true, e);
        } catch (RuntimeException e) {
            throw new CapabilityException("Unusable Claude response: " + e.getMessage(), false, e);
        }
    }
}
