package com.fry.backend.dto;

import com.fry.backend.model.PainScore;

public record LossAnalysis(
        PainScore score,
        PatternAnalysis patterns,
        PainIndices painIndices
) {}
