package com.agenttrader.api.model;

import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Body of {@code POST /api/train}; an empty or missing list trains on the configured universe.
 */
public record TrainCommand(
    @Size(max = 500, message = "At most 500 symbols per training run")
    List<String> symbols
) {
}
