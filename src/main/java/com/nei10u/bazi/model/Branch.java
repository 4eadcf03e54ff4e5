package com.nei10u.bazi.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 十二地支及其藏干（本气、中气、余气顺序不可调换，取格优先看本气）
 */
public enum Branch {
    ZI("子", Element.WATER, Polarity.YANG, List.of(new HiddenStem(Stem.GUI, 10))),
    CHOU("丑", Element.EARTH, Polarity.YIN, List.of(new HiddenStem(Stem.JI, 6), new HiddenStem(Stem.GUI, 3), new HiddenStem(Stem.XIN, 1))),
    YIN("寅", Element.WOOD, Polarity.YANG, List.of(new HiddenStem(Stem.JIA, 6), new HiddenStem(Stem.BING, 3), new HiddenStem(Stem.WU, 1))),
    MAO("卯", Element.WOOD, Polarity.YIN, List.of(new HiddenStem(Stem.YI, 10))),
    CHEN("辰", Element.EARTH, Polarity.YANG, List.of(new HiddenStem(Stem.WU, 6), new HiddenStem(Stem.YI, 3), new HiddenStem(Stem.GUI, 1))),
    SI("巳", Element.FIRE, Polarity.YIN, List.of(new HiddenStem(Stem.BING, 6), new HiddenStem(Stem.WU, 3), new HiddenStem(Stem.GENG, 1))),
    WU("午", Element.FIRE, Polarity.YANG, List.of(new HiddenStem(Stem.DING, 7), new HiddenStem(Stem.JI, 3))),
    WEI("未", Element.EARTH, Polarity.YIN, List.of(new HiddenStem(Stem.JI, 6), new HiddenStem(Stem.DING, 3), new HiddenStem(Stem.YI, 1))),
    SHEN("申", Element.METAL, Polarity.YANG, List.of(new HiddenStem(Stem.GENG, 6), new HiddenStem(Stem.REN, 3), new HiddenStem(Stem.WU, 1))),
    YOU("酉", Element.METAL, Polarity.YIN, List.of(new HiddenStem(Stem.XIN, 10))),
    XU("戌", Element.EARTH, Polarity.YANG, List.of(new HiddenStem(Stem.WU, 6), new HiddenStem(Stem.XIN, 3), new HiddenStem(Stem.DING, 1))),
    HAI("亥", Element.WATER, Polarity.YIN, List.of(new HiddenStem(Stem.REN, 7), new HiddenStem(Stem.JIA, 3)));

    private static final Map<String, Branch> BY_SYMBOL;

    static {
        Map<String, Branch> m = new HashMap<>();
        for (Branch b : values()) {
            m.put(b.symbol, b);
        }
        BY_SYMBOL = Collections.unmodifiableMap(m);
    }

    private final String symbol;
    private final Element element;
    private final Polarity polarity;
    private final List<HiddenStem> hiddenStems;

    Branch(String symbol, Element element, Polarity polarity, List<HiddenStem> hiddenStems) {
        this.symbol = symbol;
        this.element = element;
        this.polarity = polarity;
        this.hiddenStems = hiddenStems;
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

    public List<HiddenStem> getHiddenStems() {
        return hiddenStems;
    }

    /**
     * 本气
     */
    public Stem primaryStem() {
        return hiddenStems.get(0).stem();
    }

    /**
     * 按十二支序取模定位，可传负数。
     */
    public static Branch byIndex(int index) {
        Branch[] all = values();
        return all[Math.floorMod(index, all.length)];
    }

    public static Branch fromSymbol(String symbol) {
        Branch branch = BY_SYMBOL.get(symbol);
        if (branch == null) {
            throw new InvalidChartException("未知地支: " + symbol);
        }
        return branch;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
