package com.affiliate.autopilot.pipeline.model;

public enum ThreadIntent {
    DISCOVERY(25),
    QUESTION(20),
    COMPARISON(15),
    SHOWCASE(5),
    GENERAL(0);

    private final int scoreBonus;

    ThreadIntent(int scoreBonus) {
        this.scoreBonus = scoreBonus;
    }

    public int scoreBonus() {
        return scoreBonus;
    }
}
