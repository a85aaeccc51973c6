package hasync.adapter.in.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * DTO for registering a scope (area) id.
 */
public record RegisterScopeRequest(@NotBlank @Pattern(regexp = "[A-Za-z0-9_.:-]{1,64}") String scopeId) {}
