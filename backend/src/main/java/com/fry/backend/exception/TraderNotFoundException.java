package com.fry.backend.exception;

public class TraderNotFoundException extends RuntimeException {

    private final String traderId;

    public TraderNotFoundException(String traderId) {
        super("No loss history for trader " + traderId);
        this.traderId = traderId;
    }

    public String getTraderId() {
        return traderId;
    }
}
