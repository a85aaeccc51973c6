package hasync.adapter.in.dto;

public record RevokeResponse(int revokedCount) {}
