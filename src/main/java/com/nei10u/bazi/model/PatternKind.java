package com.nei10u.bazi.model;

public enum PatternKind {
    SPECIAL("特殊格局"),
    REGULAR("普通格局");

    private final String label;

    PatternKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
