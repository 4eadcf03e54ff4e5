package com.nei10u.bazi.model;

public enum PairRelationKind {
    CLASH("冲"),
    COMBINE("合"),
    HARM("害"),
    PUNISH("刑"),
    SELF_PUNISH("自刑");

    private final String label;

    PairRelationKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
