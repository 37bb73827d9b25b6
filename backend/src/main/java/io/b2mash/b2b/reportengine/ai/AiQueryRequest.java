package io.b2mash.b2b.reportengine.ai;

public record AiQueryRequest(String query, boolean includeSuggestions) {}
