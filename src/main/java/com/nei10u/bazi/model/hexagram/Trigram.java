package com.nei10u.bazi.model.hexagram;

/**
 * 八卦。code 的 bit0 为初爻（最下），1 为阳。
 */
public enum Trigram {
    QIAN("乾", "天", "☰", 0b111),
    DUI("兑", "泽", "☱", 0b011),
    LI("离", "火", "☲", 0b101),
    ZHEN("震", "雷", "☳", 0b001),
    XUN("巽", "风", "☴", 0b110),
    KAN("坎", "水", "☵", 0b010),
    GEN("艮", "山", "☶", 0b100),
    KUN("坤", "地", "☷", 0b000);

    private static final Trigram[] BY_CODE = new Trigram[8];

    static {
        for (Trigram t : values()) {
            BY_CODE[t.code] = t;
        }
    }

    private final String name;
    private final String image;
    private final String symbol;
    private final int code;

    Trigram(String name, String image, String symbol, int code) {
        this.name = name;
        this.image = image;
        this.symbol = symbol;
        this.code = code;
    }

    public String getName() {
        return name;
    }

    public String getImage() {
        return image;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getCode() {
        return code;
    }

    public static Trigram fromCode(int code) {
        return BY_CODE[code & 0b111];
    }

    public static Trigram fromName(String name) {
        for (Trigram t : values()) {
            if (t.name.equals(name)) {
                return t;
            }
        }
        throw new IllegalArgumentException("未知卦名: " + name);
    }

    /**
     * 如 "☰ 乾(天)"
     */
    public String display() {
        return symbol + " " + name + "(" + image + ")";
    }
}
