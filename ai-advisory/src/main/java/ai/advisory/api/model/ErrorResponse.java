package ai.advisory.api.model;

public record ErrorResponse(String error, String message) {}
