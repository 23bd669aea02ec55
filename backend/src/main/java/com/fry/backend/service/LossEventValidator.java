package com.fry.backend.service;

import com.fry.backend.exception.PainValidationException;
import com.fry.backend.model.LossEvent;
import org.springframework.stereotype.Component;

@Component
public class LossEventValidator {

    public void validate(LossEvent event) {
        if (event == null) {
            throw new PainValidationException("event", "must not be null");
        }
        if (event.traderId() == null || event.traderId().isBlank()) {
            throw new PainValidationException("traderId", "must not be blank");
        }
        if (event.timestamp() == null) {
            throw new PainValidationException("timestamp", "must not be null");
        }
        requireFinite("dollarLoss", event.dollarLoss());
        requireFinite("accountEquity", event.accountEquity());
        requireFinite("positionSize", event.positionSize());
        requireFinite("leverage", event.leverage());
        requireFinite("volatility", event.volatility());
        requireFinite("timeInPosition", event.timeInPosition());

        if (event.dollarLoss() <= 0) {
            throw new PainValidationException("dollarLoss", "must be greater than 0");
        }
        if (event.accountEquity() <= 0) {
            throw new PainValidationException("accountEquity", "must be greater than 0");
        }
        if (event.leverage() < 1) {
            throw new PainValidationException("leverage", "must be at least 1");
        }
        if (event.volatility() < 0 || event.volatility() > 1) {
            throw new PainValidationException("volatility", "must be between 0 and 1");
        }
        if (event.positionSize() < 0) {
            throw new PainValidationException("positionSize", "must not be negative");
        }
        if (event.timeInPosition() < 0) {
            throw new PainValidationException("timeInPosition", "must not be negative");
        }
    }

    private void requireFinite(String field, double value) {
        if (!Double.isFinite(value)) {
            throw new PainValidationException(field, "must be a finite number");
        }
    }
}
