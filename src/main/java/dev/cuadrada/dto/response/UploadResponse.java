package dev.cuadrada.dto.response;

public record UploadResponse(String status, String submissionId, String statusUrl) {

    public static UploadResponse queued(String submissionId) {
        return new UploadResponse("queued", submissionId, "/api/status/" + submissionId);
    }
}
