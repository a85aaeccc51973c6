package hasync.adapter.in.dto;

import java.util.Set;

import jakarta.validation.constraints.NotNull;

public record UpdateScopesRequest(@NotNull Set<String> assignedScopes) {}
