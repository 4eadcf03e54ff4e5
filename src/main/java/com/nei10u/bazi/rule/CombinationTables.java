package com.nei10u.bazi.rule;

import com.nei10u.bazi.model.Branch;
import com.nei10u.bazi.model.Element;
import com.nei10u.bazi.model.Stem;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.nei10u.bazi.model.Branch.*;

/**
 * 干支合冲刑害静态表。表内顺序即报告顺序。
 */
public final class CombinationTables {

    /** 三会方局 */
    public static final List<Trio> ASSEMBLIES = List.of(
            new Trio(Set.of(HAI, ZI, CHOU), Element.WATER, "北方水局"),
            new Trio(Set.of(YIN, MAO, CHEN), Element.WOOD, "东方木局"),
            new Trio(Set.of(SI, WU, WEI), Element.FIRE, "南方火局"),
            new Trio(Set.of(SHEN, YOU, XU), Element.METAL, "西方金局")
    );

    /** 三合局 */
    public static final List<Trio> HARMONY_TRIOS = List.of(
            new Trio(Set.of(SHEN, ZI, CHEN), Element.WATER, "申子辰三合水局"),
            new Trio(Set.of(HAI, MAO, WEI), Element.WOOD, "亥卯未三合木局"),
            new Trio(Set.of(YIN, WU, XU), Element.FIRE, "寅午戌三合火局"),
            new Trio(Set.of(SI, YOU, CHOU), Element.METAL, "巳酉丑三合金局")
    );

    /** 六合 */
    public static final List<Pair> SIX_HARMONIES = List.of(
            new Pair(ZI, CHOU, Element.EARTH, "子丑合土"),
            new Pair(YIN, HAI, Element.WOOD, "寅亥合木"),
            new Pair(MAO, XU, Element.FIRE, "卯戌合火"),
            new Pair(CHEN, YOU, Element.METAL, "辰酉合金"),
            new Pair(SI, SHEN, Element.WATER, "巳申合水"),
            new Pair(WU, WEI, Element.EARTH, "午未合土")
    );

    /** 六冲 */
    public static final List<Pair> SIX_CLASHES = List.of(
            new Pair(ZI, WU, null, "子午冲"),
            new Pair(CHOU, WEI, null, "丑未冲"),
            new Pair(YIN, SHEN, null, "寅申冲"),
            new Pair(MAO, YOU, null, "卯酉冲"),
            new Pair(CHEN, XU, null, "辰戌冲"),
            new Pair(SI, HAI, null, "巳亥冲")
    );

    /** 六害 */
    public static final List<Pair> SIX_HARMS = List.of(
            new Pair(ZI, WEI, null, "子未害"),
            new Pair(CHOU, WU, null, "丑午害"),
            new Pair(YIN, SI, null, "寅巳害"),
            new Pair(MAO, CHEN, null, "卯辰害"),
            new Pair(SHEN, HAI, null, "申亥害"),
            new Pair(YOU, XU, null, "酉戌害")
    );

    /** 两两相刑（三刑拆成两两，外加子卯） */
    public static final List<Pair> PUNISHMENTS = List.of(
            new Pair(YIN, SI, null, "寅巳刑（无恩之刑）"),
            new Pair(SI, SHEN, null, "巳申刑（无恩之刑）"),
            new Pair(SHEN, YIN, null, "申寅刑（无恩之刑）"),
            new Pair(CHOU, XU, null, "丑戌刑（恃势之刑）"),
            new Pair(XU, WEI, null, "戌未刑（恃势之刑）"),
            new Pair(WEI, CHOU, null, "未丑刑（恃势之刑）"),
            new Pair(ZI, MAO, null, "子卯刑（无礼之刑）")
    );

    /** 自刑 */
    public static final Set<Branch> SELF_PUNISHMENT = Collections.unmodifiableSet(EnumSet.of(CHEN, WU, YOU, HAI));

    /** 天干五合及所化五行 */
    private static final Map<Set<Stem>, Element> STEM_COMBINES;

    static {
        Map<Set<Stem>, Element> m = new LinkedHashMap<>();
        m.put(Set.of(Stem.JIA, Stem.JI), Element.EARTH);
        m.put(Set.of(Stem.YI, Stem.GENG), Element.METAL);
        m.put(Set.of(Stem.BING, Stem.XIN), Element.WATER);
        m.put(Set.of(Stem.DING, Stem.REN), Element.WOOD);
        m.put(Set.of(Stem.WU, Stem.GUI), Element.FIRE);
        STEM_COMBINES = Collections.unmodifiableMap(m);
    }

    private CombinationTables() {
    }

    /**
     * 两干是否五合，合则返回所化五行。
     */
    public static Optional<Element> stemCombine(Stem a, Stem b) {
        if (a == b) {
            return Optional.empty();
        }
        return Optional.ofNullable(STEM_COMBINES.get(Set.of(a, b)));
    }

    public static Optional<Pair> find(List<Pair> table, Branch a, Branch b) {
        return table.stream().filter(p -> p.matches(a, b)).findFirst();
    }

    public record Trio(Set<Branch> members, Element element, String name) {
    }

    /**
     * 无序地支对。element 为合化五行，冲刑害为 null。
     */
    public record Pair(Branch first, Branch second, Element element, String name) {

        public boolean matches(Branch a, Branch b) {
            return (first == a && second == b) || (first == b && second == a);
        }

        public boolean presentIn(Set<Branch> branches) {
            return branches.contains(first) && branches.contains(second);
        }
    }
}
