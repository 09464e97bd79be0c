package com.z254.autodev.swarm.resilience;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.autodev.swarm.llm.ChatMessage;
import com.z254.autodev.swarm.llm.CompletionRequest;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic key for a normalized request: provider, message roles and trimmed contents,
 * temperature and max tokens, serialized in a fixed field order and hashed with SHA-256.
 */
@Component
public class CacheKeyGenerator {

    private final ObjectMapper objectMapper;

    public CacheKeyGenerator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String keyFor(String provider, CompletionRequest request) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        normalized.put("provider", provider);
        List<Map<String, String>> messages = new ArrayList<>();
        for (ChatMessage message : request.getMessages()) {
            Map<String, String> normalizedMessage = new LinkedHashMap<>();
            normalizedMessage.put("role", message.getRole());
            normalizedMessage.put("content", message.getContent() != null ? message.getContent().trim() : "");
            messages.add(normalizedMessage);
        }
        normalized.put("messages", messages);
        normalized.put("temperature", request.getTemperature());
        normalized.put("maxTokens", request.getMaxTokens());
        try {
            return sha256(objectMapper.writeValueAsString(normalized));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize request for cache key", e);
        }
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
