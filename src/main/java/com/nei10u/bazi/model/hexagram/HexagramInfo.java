package com.nei10u.bazi.model.hexagram;

/**
 * 六十四卦表中的一卦
 */
public record HexagramInfo(int number, String name, String shortName, Trigram upper, Trigram lower, String meaning) {

    /**
     * 低三位下卦，高三位上卦
     */
    public int code() {
        return (upper.getCode() << 3) | lower.getCode();
    }
}
