package com.nei10u.bazi.model;

public enum Gender {
    MALE("男"),
    FEMALE("女");

    private final String label;

    Gender(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * "男" / "女"，其余一律视为非法输入。
     */
    public static Gender fromLabel(String label) {
        for (Gender g : values()) {
            if (g.label.equals(label)) {
                return g;
            }
        }
        throw new InvalidChartException("未知性别: " + label);
    }
}
