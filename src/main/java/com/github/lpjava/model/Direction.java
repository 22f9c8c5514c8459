package com.github.lpjava.model;

/**
 * Objective direction.
 */
public enum Direction {
    MINIMIZE("Minimize"),
    MAXIMIZE("Maximize");

    private final String keyword;

    Direction(String keyword) {
        this.keyword = keyword;
    }

    /**
     * @return the section keyword used in LP files
     */
    public String keyword() {
        return keyword;
    }
}
