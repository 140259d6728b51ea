package com.entity.datamining.router;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * JSON encoding of request and response envelopes.
 */
public class RequestCodec {
    private static final Logger log = LoggerFactory.getLogger(RequestCodec.class);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RequestCodec() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false), Clock.systemUTC());
    }

    public RequestCodec(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Parses a request envelope.
     *
     * @throws JsonProcessingException if the input is not a JSON object of the expected shape
     */
    public OrchestratorRequest decode(String json) throws JsonProcessingException {
        return objectMapper.readValue(json == null ? "" : json, OrchestratorRequest.class);
    }

    /**
     * Serializes a response. Payloads that cannot be serialized produce a failure envelope instead.
     */
    public String encode(OrchestratorResponse response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            log.error("codec.encodeFailed error={}", e.getOriginalMessage(), e);
            OrchestratorResponse fallback = OrchestratorResponse.failure(
                    "response could not be serialized: " + e.getOriginalMessage(), clock.instant());
            try {
                return objectMapper.writeValueAsString(fallback);
            } catch (JsonProcessingException unexpected) {
                throw new IllegalStateException("Failed to serialize fallback response", unexpected);
            }
        }
    }

    /**
     * Decodes a request, or returns the failure envelope to send back when it cannot be parsed.
     */
    public DecodeResult decodeOrError(String json) {
        try {
            OrchestratorRequest request = decode(json);
            if (request == null) {
                return new DecodeResult(null,
                        OrchestratorResponse.failure("invalid JSON input: expected an object", clock.instant()));
            }
            return new DecodeResult(request, null);
        } catch (JsonProcessingException e) {
            log.warn("codec.invalidRequest error={}", e.getOriginalMessage());
            return new DecodeResult(null,
                    OrchestratorResponse.failure("invalid JSON input: " + e.getOriginalMessage(), clock.instant()));
        }
    }

    /**
     * Either a parsed request or the error response to return.
     */
    public record DecodeResult(OrchestratorRequest request, OrchestratorResponse error) {
        public boolean isValid() {
            return request != null;
        }
    }
}
