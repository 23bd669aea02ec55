package com.fry.backend.dto;

public record PainIndices(
        double retailPainIndex,
        double whalePainIndex,
        double leveragePainIndex,
        double painConcentration
) {

    public static PainIndices empty() {
        return new PainIndices(0.0, 0.0, 0.0, 0.0);
    }
}
