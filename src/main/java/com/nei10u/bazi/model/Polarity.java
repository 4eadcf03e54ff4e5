package com.nei10u.bazi.model;

public enum Polarity {
    YANG("阳"),
    YIN("阴");

    private final String label;

    Polarity(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
