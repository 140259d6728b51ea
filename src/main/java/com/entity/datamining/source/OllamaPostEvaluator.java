package com.entity.datamining.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Post evaluator backed by a local Ollama model.
 *
 * Ollama must be running (default: http://localhost:11434).
 *
 * Usage:
 * <pre>
 * PostEvaluator evaluator = OllamaPostEvaluator.builder()
 *     .baseUrl("http://localhost:11434")
 *     .model("llama3.2")
 *     .build();
 * </pre>
 */
public class OllamaPostEvaluator implements PostEvaluator {
    private static final Logger log = LoggerFactory.getLogger(OllamaPostEvaluator.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_MODEL = "llama3.2";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    static final List<String> REQUIRED_KEYS = List.of(
            "sentiment_classification",
            "sentiment_justification",
            "main_topics",
            "suggested_local_data"
    );

    private final String baseUrl;
    private final String model;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private OllamaPostEvaluator(Builder builder) {
        this.baseUrl = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public FetchResult evaluate(String postText) {
        if (postText == null || postText.isBlank()) {
            return FetchResult.failure("Post text cannot be empty.");
        }
        log.info("Evaluating post via Ollama: '{}...'", abbreviate(postText, 50));

        String response;
        try {
            response = callOllama(buildPrompt(postText));
        } catch (IOException e) {
            log.error("Error calling Ollama: {}", e.getMessage(), e);
            return FetchResult.failure("AI evaluation failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.failure("AI evaluation interrupted");
        }
        return parseEvaluation(response);
    }

    @Override
    public String getEvaluatorName() {
        return "Ollama/" + model;
    }

    /**
     * Builds the analysis prompt for a post.
     */
    String buildPrompt(String postText) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Analyze the following text post from a political figure or influencer. ");
        prompt.append("Provide the analysis as a JSON object with the following keys:\n");
        prompt.append("- \"sentiment_classification\": the primary sentiment ");
        prompt.append("(e.g., Positive, Negative, Neutral, Mixed, Assertive, Critical, Supportive).\n");
        prompt.append("- \"sentiment_justification\": the reasoning for the classification (1-2 sentences).\n");
        prompt.append("- \"main_topics\": a list of 2-4 main political or social topics discussed or implied.\n");
        prompt.append("- \"suggested_local_data\": a list of 1-3 types of local data relevant to ");
        prompt.append("responding to the post (e.g., \"Politician Voting Record\", \"Related Campaign Finance Data\").\n\n");
        prompt.append("Text Post:\n");
        prompt.append(postText).append("\n\n");
        prompt.append("Provide the output strictly in JSON format:\n");
        return prompt.toString();
    }

    /**
     * Parses the model output, tolerating a surrounding ```json fence.
     */
    FetchResult parseEvaluation(String response) {
        String text = response == null ? "" : response.strip();
        if (text.startsWith("```json")) {
            text = text.substring(7);
        } else if (text.startsWith("```")) {
            text = text.substring(3);
        }
        if (text.endsWith("```")) {
            text = text.substring(0, text.length() - 3);
        }

        Map<String, Object> analysis;
        try {
            analysis = objectMapper.readValue(text.strip(), new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            log.error("AI response was not valid JSON: {}", e.getOriginalMessage());
            log.debug("Raw AI response: {}", response);
            return FetchResult.failure("AI response was not valid JSON.");
        }

        List<String> missing = REQUIRED_KEYS.stream().filter(k -> !analysis.containsKey(k)).toList();
        if (!missing.isEmpty()) {
            log.warn("AI evaluation is missing keys {}", missing);
        }
        log.info("Successfully evaluated post.");
        return FetchResult.success(analysis);
    }

    private String callOllama(String prompt) throws IOException, InterruptedException {
        OllamaRequest ollamaRequest = new OllamaRequest(model, prompt, false);
        String requestBody = objectMapper.writeValueAsString(ollamaRequest);

        log.debug("Calling Ollama with model: {}", model);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/generate"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        if (response.statusCode() != 200) {
            throw new IOException("Ollama returned status " + response.statusCode() + ": " + response.body());
        }

        OllamaResponse ollamaResponse = objectMapper.readValue(response.body(), OllamaResponse.class);
        log.debug("Ollama response received, length: {}", ollamaResponse.response().length());

        return ollamaResponse.response();
    }

    private static String abbreviate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String model;
        private Duration timeout;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public OllamaPostEvaluator build() {
            return new OllamaPostEvaluator(this);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record OllamaRequest(
            String model,
            String prompt,
            boolean stream
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record OllamaResponse(
            String model,
            @JsonProperty("created_at") String createdAt,
            String response,
            boolean done
    ) {}
}
