package com.fry.backend.dto;

import java.util.List;

/**
 * Outcome of a batch submission. Both lists are in input order; {@code index} points into the submitted batch.
 */
public record BatchResult(
        int submitted,
        List<AcceptedLoss> accepted,
        List<RejectedLoss> rejected
) {

    public record AcceptedLoss(int index, LossAnalysis analysis) {}

    public record RejectedLoss(int index, String traderId, String field, String message) {}
}
