package com.fry.backend.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public record LossBatchRequest(@NotNull List<LossEventRequest> events) {}
