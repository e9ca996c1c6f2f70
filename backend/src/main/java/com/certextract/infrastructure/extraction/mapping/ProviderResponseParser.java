package com.certextract.infrastructure.extraction.mapping;

import com.certextract.domain.extraction.model.ProviderResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns free-form model output into {@link ProviderResponse.ParsedJson} or
 * {@link ProviderResponse.MalformedResponse}. Never throws.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProviderResponseParser {

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```", Pattern.CASE_INSENSITIVE);

    private final ObjectMapper objectMapper;

    public ProviderResponse parse(String content) {
        if (content == null || content.isBlank()) {
            return new ProviderResponse.MalformedResponse(content, "empty response");
        }

        String candidate = content.trim();
        Matcher fence = CODE_FENCE.matcher(candidate);
        if (fence.find()) {
            candidate = fence.group(1).trim();
        }

        int start = candidate.indexOf('{');
        int end = candidate.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return new ProviderResponse.MalformedResponse(content, "no JSON object found");
        }

        try {
            JsonNode node = objectMapper.readTree(candidate.substring(start, end + 1));
            if (node == null || !node.isObject()) {
                return new ProviderResponse.MalformedResponse(content, "response is not a JSON object");
            }
            return new ProviderResponse.ParsedJson(node, content);
        } catch (JsonProcessingException e) {
            log.warn("[Mapping] Failed to parse provider JSON: {}", e.getOriginalMessage());
            return new ProviderResponse.MalformedResponse(content, "invalid JSON: " + e.getOriginalMessage());
        }
    }
}
