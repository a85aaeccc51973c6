package hasync.adapter.in.dto;

public record PublishEventResponse(int delivered) {}
