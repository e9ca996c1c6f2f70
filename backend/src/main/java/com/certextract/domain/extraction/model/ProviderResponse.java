package com.certextract.domain.extraction.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw provider output at the adapter boundary: either a parsed JSON object or a response
 * that could not be parsed. The mapping layer never assumes a shape beyond this.
 */
public interface ProviderResponse {

    String raw();

    record ParsedJson(JsonNode json, String raw) implements ProviderResponse {}

    record MalformedResponse(String raw, String reason) implements ProviderResponse {}
}
