package com.nei10u.bazi.model.hexagram;

/**
 * 金钱课爻值：三枚硬币之和
 */
public enum LineType {
    OLD_YIN(6, "老阴", false, true),
    YOUNG_YANG(7, "少阳", true, false),
    YOUNG_YIN(8, "少阴", false, false),
    OLD_YANG(9, "老阳", true, true);

    private final int value;
    private final String label;
    private final boolean yang;
    private final boolean moving;

    LineType(int value, String label, boolean yang, boolean moving) {
        this.value = value;
        this.label = label;
        this.yang = yang;
        this.moving = moving;
    }

    public int getValue() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    public boolean isYang() {
        return yang;
    }

    public boolean isMoving() {
        return moving;
    }

    public static LineType fromValue(int value) {
        for (LineType t : values()) {
            if (t.value == value) {
                return t;
            }
        }
        throw new IllegalArgumentException("爻值只能是 6/7/8/9: " + value);
    }
}
