package com.nei10u.bazi.model;

public enum PillarRole {
    YEAR("年"),
    MONTH("月"),
    DAY("日"),
    HOUR("时");

    private final String label;

    PillarRole(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
