package com.nei10u.bazi.model;

public enum StrengthLabel {
    STRONG("身旺"),
    WEAK("身弱");

    private final String label;

    StrengthLabel(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
