package com.scorebot.engine.model;

import java.util.Objects;

public final class ScoreResult {
    public final int buyScore;
    public final int shortScore;
    public final SignalFlags signals;

    public ScoreResult(int buyScore, int shortScore, SignalFlags signals) {
        this.buyScore = buyScore;
        this.shortScore = shortScore;
        this.signals = signals;
    }

    public int maxScore() {
        return Math.max(buyScore, shortScore);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScoreResult)) {
            return false;
        }
        ScoreResult other = (ScoreResult) o;
        return buyScore == other.buyScore
                && shortScore == other.shortScore
                && Objects.equals(signals, other.signals);
    }

    @Override
    public int hashCode() {
        return Objects.hash(buyScore, shortScore, signals);
    }
}
