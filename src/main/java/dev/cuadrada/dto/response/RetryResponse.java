package dev.cuadrada.dto.response;

import java.util.List;

public record RetryResponse(boolean success, String submissionId, List<String> reviewers) {}
