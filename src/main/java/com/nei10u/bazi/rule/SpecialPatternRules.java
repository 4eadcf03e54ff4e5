package com.nei10u.bazi.rule;

import com.nei10u.bazi.model.Branch;
import com.nei10u.bazi.model.Chart;
import com.nei10u.bazi.model.Element;
import com.nei10u.bazi.model.Stem;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * 特殊杂格判定链。列表顺序即优先级：冲奔 → 遥合 → 日时 → 气象 → 化气，首个命中者胜出。
 */
public final class SpecialPatternRules {

    public enum Family {
        CHONG_BEN("冲奔类"),
        YAO_HE("遥合类"),
        DAY_HOUR("日时组合类"),
        PURE_IMAGE("气象类"),
        TRANSFORMATION("化气类");

        private final String label;

        Family(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    public interface Rule {

        Family family();

        /**
         * 命中则返回格名
         */
        Optional<String> match(Chart chart);
    }

    private record NamedRule(Family family, String name, Predicate<Chart> predicate) implements Rule {
        @Override
        public Optional<String> match(Chart chart) {
            return predicate.test(chart) ? Optional.of(name) : Optional.empty();
        }
    }

    private record DerivedRule(Family family, Function<Chart, Optional<String>> matcher) implements Rule {
        @Override
        public Optional<String> match(Chart chart) {
            return matcher.apply(chart);
        }
    }

    /** 飞天禄马：日干 → 须三见以上的日支 */
    private static final Map<Stem, Branch> FEI_TIAN = Map.of(
            Stem.GENG, Branch.ZI, Stem.REN, Branch.ZI,
            Stem.XIN, Branch.HAI, Stem.GUI, Branch.HAI);

    /** 拱禄：日干 → 日时两支（不分先后） */
    private static final Map<Stem, Set<Branch>> GONG_LU = Map.of(
            Stem.GUI, Set.of(Branch.HAI, Branch.CHOU),
            Stem.DING, Set.of(Branch.SI, Branch.WEI),
            Stem.JI, Set.of(Branch.SI, Branch.WEI));

    /** 拱贵 */
    private static final Map<Stem, Set<Branch>> GONG_GUI = Map.of(
            Stem.JIA, Set.of(Branch.SHEN, Branch.XU));

    private static final Set<String> KUI_GANG = Set.of("戊戌", "庚戌", "庚辰", "壬辰");

    private static final Set<String> JIN_SHEN = Set.of("癸酉", "己巳", "乙丑");

    /** 一行得气：地支尽归日主五行 */
    private static final Map<Element, String> ZHUAN_WANG;

    static {
        Map<Element, String> m = new EnumMap<>(Element.class);
        m.put(Element.WOOD, "曲直格");
        m.put(Element.FIRE, "炎上格");
        m.put(Element.EARTH, "稼穑格");
        m.put(Element.METAL, "从革格");
        m.put(Element.WATER, "润下格");
        ZHUAN_WANG = Collections.unmodifiableMap(m);
    }

    public static final List<Rule> CHAIN = List.of(
            // 冲奔
            new NamedRule(Family.CHONG_BEN, "飞天禄马格", c -> {
                Branch need = FEI_TIAN.get(c.getDayMaster());
                return need != null && c.getDay().branch() == need && count(c, need) >= 3;
            }),
            new NamedRule(Family.CHONG_BEN, "井栏叉马格", c -> c.getDayMaster() == Stem.GENG
                    && c.getBranches().containsAll(Set.of(Branch.SHEN, Branch.ZI, Branch.CHEN))),
            new NamedRule(Family.CHONG_BEN, "壬骑龙背格", c -> {
                if (c.getDayMaster() != Stem.REN || c.getDay().branch() != Branch.CHEN) {
                    return false;
                }
                long chen = count(c, Branch.CHEN);
                long yin = count(c, Branch.YIN);
                return chen >= 3 || (yin >= 1 && chen >= 2) || yin >= 3;
            }),
            // 遥合
            new NamedRule(Family.YAO_HE, "子遥巳格", c -> c.getDayMaster() == Stem.JIA
                    && c.getDay().branch() == Branch.ZI && count(c, Branch.ZI) >= 2),
            new NamedRule(Family.YAO_HE, "丑遥巳格", c -> (c.getDayMaster() == Stem.GUI || c.getDayMaster() == Stem.XIN)
                    && c.getDay().branch() == Branch.CHOU && count(c, Branch.CHOU) >= 2),
            // 日时组合
            new NamedRule(Family.DAY_HOUR, "六乙鼠贵格", c -> c.getDayMaster() == Stem.YI
                    && c.getHour().branch() == Branch.ZI),
            new NamedRule(Family.DAY_HOUR, "六阴朝阳格", c -> c.getDayMaster() == Stem.XIN
                    && c.getHour().branch() == Branch.ZI),
            new NamedRule(Family.DAY_HOUR, "刑合格", c -> c.getDayMaster() == Stem.GUI
                    && "甲寅".equals(c.getHour().ganZhi())),
            new NamedRule(Family.DAY_HOUR, "拱禄格", c -> flanks(GONG_LU, c)),
            new NamedRule(Family.DAY_HOUR, "拱贵格", c -> flanks(GONG_GUI, c)),
            new NamedRule(Family.DAY_HOUR, "日禄归时格", c -> SpiritTables.lu(c.getDayMaster()) == c.getHour().branch()),
            // 气象
            new NamedRule(Family.PURE_IMAGE, "天元一气格", c -> c.getStems().stream().distinct().count() == 1),
            new NamedRule(Family.PURE_IMAGE, "地元一气格", c -> c.getBranches().stream().distinct().count() == 1),
            new DerivedRule(Family.PURE_IMAGE, c -> {
                Element dm = c.getDayMaster().getElement();
                boolean all = c.getBranches().stream().allMatch(b -> b.getElement() == dm);
                return all ? Optional.of(ZHUAN_WANG.get(dm)) : Optional.empty();
            }),
            new NamedRule(Family.PURE_IMAGE, "魁罡格", c -> KUI_GANG.contains(c.getDay().ganZhi())),
            new NamedRule(Family.PURE_IMAGE, "金神格", c -> JIN_SHEN.contains(c.getHour().ganZhi())),
            // 化气：日干与月干五合，且月令正是所化之气
            new DerivedRule(Family.TRANSFORMATION, c -> CombinationTables
                    .stemCombine(c.getDayMaster(), c.getMonth().stem())
                    .filter(e -> c.getMonth().branch().getElement() == e)
                    .map(e -> "化" + e.getLabel() + "格"))
    );

    private SpecialPatternRules() {
    }

    private static long count(Chart chart, Branch branch) {
        return chart.getBranches().stream().filter(b -> b == branch).count();
    }

    /**
     * 日支、时支恰好分居两侧，虚拱其中
     */
    private static boolean flanks(Map<Stem, Set<Branch>> table, Chart chart) {
        Set<Branch> pair = table.get(chart.getDayMaster());
        if (pair == null) {
            return false;
        }
        Branch day = chart.getDay().branch();
        Branch hour = chart.getHour().branch();
        return day != hour && pair.contains(day) && pair.contains(hour);
    }
}
