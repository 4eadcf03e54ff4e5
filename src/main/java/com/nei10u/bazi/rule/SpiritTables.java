package com.nei10u.bazi.rule;

import com.nei10u.bazi.model.Branch;
import com.nei10u.bazi.model.Stem;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 神煞查表。每条规则：以某一柱的干或支为键，查得目标干支集合，命盘中见之即为有。
 * 表项写作 "键=目标..."，目标可以是天干也可以是地支。
 */
public final class SpiritTables {

    public enum Basis {
        DAY_STEM("日干"),
        DAY_BRANCH("日支"),
        MONTH_BRANCH("月支"),
        YEAR_BRANCH("年支");

        private final String label;

        Basis(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    public record SpiritRule(String name, Basis basis, Map<String, List<String>> targets) {

        public List<String> targetsOf(String key) {
            return targets.getOrDefault(key, List.of());
        }
    }

    private static final Map<String, String> LU = parse(
            "甲=寅", "乙=卯", "丙=巳", "丁=午", "戊=巳", "己=午", "庚=申", "辛=酉", "壬=亥", "癸=子");

    private static final Map<String, String> YANG_REN = parse(
            "甲=卯", "乙=寅", "丙=午", "丁=巳", "戊=午", "己=巳", "庚=酉", "辛=申", "壬=子", "癸=亥");

    public static final List<SpiritRule> RULES = List.of(
            rule("天乙贵人", Basis.DAY_STEM,
                    "甲=丑未", "戊=丑未", "庚=丑未", "乙=子申", "己=子申",
                    "丙=亥酉", "丁=亥酉", "壬=巳卯", "癸=巳卯", "辛=午寅"),
            rule("文昌", Basis.DAY_STEM,
                    "甲=巳午", "乙=巳午", "丙=申酉", "丁=申酉", "戊=申酉",
                    "己=申酉", "庚=亥子", "辛=亥子", "壬=寅卯", "癸=寅卯"),
            rule("太极", Basis.DAY_STEM,
                    "甲=子午", "乙=子午", "丙=卯酉", "丁=卯酉", "戊=辰戌丑未",
                    "己=辰戌丑未", "庚=寅亥", "辛=寅亥", "壬=巳申", "癸=巳申"),
            rule("福星", Basis.DAY_STEM,
                    "甲=丑未", "乙=丑未", "丙=子申", "丁=子申", "戊=寅戌",
                    "己=寅戌", "庚=卯亥", "辛=卯亥", "壬=巳酉", "癸=巳酉"),
            rule("国印", Basis.DAY_STEM,
                    "甲=戌", "乙=亥", "丙=丑", "丁=寅", "戊=丑", "己=寅", "庚=辰", "辛=巳", "壬=未", "癸=申"),
            rule("禄神", Basis.DAY_STEM, LU),
            rule("羊刃", Basis.DAY_STEM, YANG_REN),
            // 三合局查法：申子辰、寅午戌、巳酉丑、亥卯未
            rule("桃花", Basis.DAY_BRANCH,
                    "申=酉", "子=酉", "辰=酉", "寅=卯", "午=卯", "戌=卯",
                    "巳=午", "酉=午", "丑=午", "亥=子", "卯=子", "未=子"),
            rule("驿马", Basis.DAY_BRANCH,
                    "申=寅", "子=寅", "辰=寅", "寅=申", "午=申", "戌=申",
                    "巳=亥", "酉=亥", "丑=亥", "亥=巳", "卯=巳", "未=巳"),
            rule("华盖", Basis.DAY_BRANCH,
                    "申=辰", "子=辰", "辰=辰", "寅=戌", "午=戌", "戌=戌",
                    "巳=丑", "酉=丑", "丑=丑", "亥=未", "卯=未", "未=未"),
            rule("将星", Basis.DAY_BRANCH,
                    "申=子", "子=子", "辰=子", "寅=午", "午=午", "戌=午",
                    "巳=酉", "酉=酉", "丑=酉", "亥=卯", "卯=卯", "未=卯"),
            rule("天德", Basis.MONTH_BRANCH,
                    "寅=丁", "卯=申", "辰=壬", "巳=辛", "午=亥", "未=甲",
                    "申=癸", "酉=寅", "戌=丙", "亥=乙", "子=巳", "丑=庚"),
            rule("月德", Basis.MONTH_BRANCH,
                    "寅=丙", "卯=甲", "辰=壬", "巳=庚", "午=丙", "未=甲",
                    "申=壬", "酉=庚", "戌=丙", "亥=甲", "子=壬", "丑=庚"),
            rule("红鸾", Basis.YEAR_BRANCH,
                    "子=卯", "丑=寅", "寅=丑", "卯=子", "辰=亥", "巳=戌",
                    "午=酉", "未=申", "申=未", "酉=午", "戌=巳", "亥=辰"),
            rule("天喜", Basis.YEAR_BRANCH,
                    "子=酉", "丑=申", "寅=未", "卯=午", "辰=巳", "巳=辰",
                    "午=卯", "未=寅", "申=丑", "酉=子", "戌=亥", "亥=戌"),
            rule("孤辰", Basis.YEAR_BRANCH,
                    "亥=寅", "子=寅", "丑=寅", "寅=巳", "卯=巳", "辰=巳",
                    "巳=申", "午=申", "未=申", "申=亥", "酉=亥", "戌=亥"),
            rule("寡宿", Basis.YEAR_BRANCH,
                    "亥=戌", "子=戌", "丑=戌", "寅=丑", "卯=丑", "辰=丑",
                    "巳=辰", "午=辰", "未=辰", "申=未", "酉=未", "戌=未")
    );

    private SpiritTables() {
    }

    /**
     * 日干之禄
     */
    public static Branch lu(Stem dayMaster) {
        return Branch.fromSymbol(LU.get(dayMaster.getSymbol()));
    }

    private static SpiritRule rule(String name, Basis basis, String... entries) {
        return rule(name, basis, parse(entries));
    }

    private static SpiritRule rule(String name, Basis basis, Map<String, String> table) {
        Map<String, List<String>> targets = new HashMap<>();
        table.forEach((k, v) -> targets.put(k, v.codePoints().mapToObj(cp -> new String(Character.toChars(cp))).toList()));
        return new SpiritRule(name, basis, Collections.unmodifiableMap(targets));
    }

    private static Map<String, String> parse(String... entries) {
        Map<String, String> m = new HashMap<>();
        for (String e : entries) {
            int eq = e.indexOf('=');
            m.put(e.substring(0, eq), e.substring(eq + 1));
        }
        return Collections.unmodifiableMap(m);
    }
}
