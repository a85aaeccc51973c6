package hasync.adapter.in.dto;

public record VerifyPinResponse(String sessionId) {}
