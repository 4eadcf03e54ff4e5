package com.nei10u.bazi.rule;

import com.nei10u.bazi.model.Element;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 五行生克表。干支本身的五行阴阳见 {@link com.nei10u.bazi.model.Stem} 与 {@link com.nei10u.bazi.model.Branch}。
 */
public final class ElementCycle {

    /** Key 生 Value */
    private static final Map<Element, Element> GENERATES;
    /** Key 克 Value */
    private static final Map<Element, Element> CONTROLS;
    private static final Map<Element, Element> GENERATED_BY;
    private static final Map<Element, Element> CONTROLLED_BY;

    static {
        Map<Element, Element> gen = new EnumMap<>(Element.class);
        gen.put(Element.WOOD, Element.FIRE);
        gen.put(Element.FIRE, Element.EARTH);
        gen.put(Element.EARTH, Element.METAL);
        gen.put(Element.METAL, Element.WATER);
        gen.put(Element.WATER, Element.WOOD);

        Map<Element, Element> ctl = new EnumMap<>(Element.class);
        ctl.put(Element.WOOD, Element.EARTH);
        ctl.put(Element.EARTH, Element.WATER);
        ctl.put(Element.WATER, Element.FIRE);
        ctl.put(Element.FIRE, Element.METAL);
        ctl.put(Element.METAL, Element.WOOD);

        Map<Element, Element> genBy = new EnumMap<>(Element.class);
        gen.forEach((k, v) -> genBy.put(v, k));
        Map<Element, Element> ctlBy = new EnumMap<>(Element.class);
        ctl.forEach((k, v) -> ctlBy.put(v, k));

        GENERATES = Collections.unmodifiableMap(gen);
        CONTROLS = Collections.unmodifiableMap(ctl);
        GENERATED_BY = Collections.unmodifiableMap(genBy);
        CONTROLLED_BY = Collections.unmodifiableMap(ctlBy);
    }

    private ElementCycle() {
    }

    public static Element generates(Element e) {
        return GENERATES.get(e);
    }

    public static Element controls(Element e) {
        return CONTROLS.get(e);
    }

    /**
     * 印星五行（生我者）
     */
    public static Element generatedBy(Element e) {
        return GENERATED_BY.get(e);
    }

    /**
     * 官杀五行（克我者）
     */
    public static Element controlledBy(Element e) {
        return CONTROLLED_BY.get(e);
    }

    /**
     * target 相对 reference 的关系，例如 relation(金, 火) == CONTROLLED_BY。
     */
    public static ElementRelation relation(Element reference, Element target) {
        if (reference == target) {
            return ElementRelation.SAME;
        }
        if (GENERATES.get(reference) == target) {
            return ElementRelation.GENERATES;
        }
        if (CONTROLS.get(reference) == target) {
            return ElementRelation.CONTROLS;
        }
        if (CONTROLLED_BY.get(reference) == target) {
            return ElementRelation.CONTROLLED_BY;
        }
        return ElementRelation.GENERATED_BY;
    }
}
