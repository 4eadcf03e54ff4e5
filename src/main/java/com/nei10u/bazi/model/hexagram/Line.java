package com.nei10u.bazi.model.hexagram;

/**
 * position 1..6，自下而上
 */
public record Line(int position, LineType type) {

    public boolean isYang() {
        return type.isYang();
    }

    public boolean isMoving() {
        return type.isMoving();
    }

    @Override
    public String toString() {
        return "第" + position + "爻: " + (type.isYang() ? "⚊ " : "⚋ ") + type.getLabel() + (type.isMoving() ? " (动爻)" : "");
    }
}
