package com.tokenx.models;

import java.util.Collections;
import java.util.List;

public class StrengthReport {

    private final int score;
    private final String level;
    private final List<String> feedback;
    private final String color;

    public StrengthReport(int score, String level, List<String> feedback, String color) {
        this.score = score;
        this.level = level;
        this.feedback = feedback == null ? List.of() : Collections.unmodifiableList(feedback);
        this.color = color;
    }

    public int getScore() {
        return score;
    }

    public String getLevel() {
        return level;
    }

    /**
     * Suggestions in rubric order; empty when nothing is missing.
     */
    public List<String> getFeedback() {
        return feedback;
    }

    /**
     * Hex color hint for rendering the meter.
     */
    public String getColor() {
        return color;
    }

    @Override
    public String toString() {
        return "StrengthReport{score=" + score + ", level='" + level + "'}";
    }
}
