package com.nei10u.bazi.model;

public enum Season {
    WINTER("冬"),
    SUMMER("夏"),
    BALANCED("春秋平季");

    private final String label;

    Season(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
