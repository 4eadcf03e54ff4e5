package com.nei10u.bazi.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * 十天干
 */
public enum Stem {
    JIA("甲", Element.WOOD, Polarity.YANG),
    YI("乙", Element.WOOD, Polarity.YIN),
    BING("丙", Element.FIRE, Polarity.YANG),
    DING("丁", Element.FIRE, Polarity.YIN),
    WU("戊", Element.EARTH, Polarity.YANG),
    JI("己", Element.EARTH, Polarity.YIN),
    GENG("庚", Element.METAL, Polarity.YANG),
    XIN("辛", Element.METAL, Polarity.YIN),
    REN("壬", Element.WATER, Polarity.YANG),
    GUI("癸", Element.WATER, Polarity.YIN);

    private static final Map<String, Stem> BY_SYMBOL;

    static {
        Map<String, Stem> m = new HashMap<>();
        for (Stem s : values()) {
            m.put(s.symbol, s);
        }
        BY_SYMBOL = Collections.unmodifiableMap(m);
    }

    private final String symbol;
    private final Element element;
    private final Polarity polarity;

    Stem(String symbol, Element element, Polarity polarity) {
        this.symbol = symbol;
        this.element = element;
        this.polarity = polarity;
    }

    public String getSymbol() {
        return symbol;
    }

    public Element getElement() {
        return element;
    }

    public Polarity getPolarity() {
        return polarity;
    }

    public static Stem fromSymbol(String symbol) {
        Stem stem = BY_SYMBOL.get(symbol);
        if (stem == null) {
            throw new InvalidChartException("未知天干: " + symbol);
        }
        return stem;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
