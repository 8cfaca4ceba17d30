package com.agenttrader.api.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Body of {@code POST /api/cycle}. Omitted symbols or risk fall back to the configured defaults.
 */
public record CycleCommand(
    @NotBlank(message = "userId is required")
    @Pattern(regexp = "^[A-Za-z0-9_.@-]{1,64}$", message = "userId must be 1-64 letters, digits or _.@-")
    String userId,

    @Size(max = 500, message = "At most 500 symbols per cycle")
    List<@NotBlank(message = "Symbols must not be blank") String> symbols,

    @DecimalMin(value = "0.0", message = "riskTolerance must be >= 0")
    @DecimalMax(value = "1.0", message = "riskTolerance must be <= 1")
    Double riskTolerance
) {
}
