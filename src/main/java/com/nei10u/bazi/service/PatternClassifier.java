package com.nei10u.bazi.service;

import com.nei10u.bazi.config.BaziEngineProperties;
import com.nei10u.bazi.model.Branch;
import com.nei10u.bazi.model.Chart;
import com.nei10u.bazi.model.HiddenStem;
import com.nei10u.bazi.model.HiddenTenGod;
import com.nei10u.bazi.model.PatternKind;
import com.nei10u.bazi.model.PatternResult;
import com.nei10u.bazi.model.PillarRole;
import com.nei10u.bazi.model.Stem;
import com.nei10u.bazi.model.TenGod;
import com.nei10u.bazi.model.TenGodProfile;
import com.nei10u.bazi.rule.SpecialPatternRules;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 格局判定：先走特殊杂格链，全部落空才按月令取八正格。
 */
@Service
@RequiredArgsConstructor
public class PatternClassifier {

    private static final Logger log = LoggerFactory.getLogger(PatternClassifier.class);

    private static final String REGULAR_FAMILY = "正格";

    /** 十神 → 八正格。比肩/劫财不在此表，走兜底格名 */
    private static final Map<TenGod, String> REGULAR_NAMES;

    static {
        Map<TenGod, String> m = new EnumMap<>(TenGod.class);
        m.put(TenGod.ZHENG_GUAN, "正官格");
        m.put(TenGod.QI_SHA, "七杀格");
        m.put(TenGod.ZHENG_CAI, "正财格");
        m.put(TenGod.PIAN_CAI, "偏财格");
        m.put(TenGod.ZHENG_YIN, "正印格");
        m.put(TenGod.PIAN_YIN, "偏印格");
        m.put(TenGod.SHI_SHEN, "食神格");
        m.put(TenGod.SHANG_GUAN, "伤官格");
        REGULAR_NAMES = Collections.unmodifiableMap(m);
    }

    private final TenGodResolver tenGodResolver;
    private final BaziEngineProperties properties;

    public PatternResult classify(Chart chart, TenGodProfile tenGods) {
        for (SpecialPatternRules.Rule rule : SpecialPatternRules.CHAIN) {
            Optional<String> hit = rule.match(chart);
            if (hit.isPresent()) {
                log.debug("special pattern hit: {} ({}) for {}", hit.get(), rule.family().getLabel(), chart);
                return PatternResult.builder()
                        .name(hit.get())
                        .kind(PatternKind.SPECIAL)
                        .family(rule.family().getLabel())
                        .basis(rule.family().getLabel() + "：" + chart.getDay().ganZhi() + "日 " + chart.getHour().ganZhi() + "时")
                        .build();
            }
        }
        return classifyRegular(chart, tenGods);
    }

    /**
     * 八正格。本气为比劫时直接落到建禄/羊刃，不再看透干；
     * 否则默认只看月令本气，开启透干取格时改取透出的中气/余气。
     */
    PatternResult classifyRegular(Chart chart, TenGodProfile tenGods) {
        Stem dm = chart.getDayMaster();
        Branch month = chart.getMonth().branch();
        Stem primary = month.primaryStem();
        TenGod primaryGod = tenGods == null
                ? tenGodResolver.resolve(dm, primary)
                : tenGods.hidden(PillarRole.MONTH, 0).map(HiddenTenGod::tenGod).orElseGet(() -> tenGodResolver.resolve(dm, primary));
        String basis = "月令" + month + "本气" + primary;

        if (primaryGod.isPeer()) {
            // 月令本气与日主同五行：八格无此名，显式落到建禄/羊刃
            String name = primaryGod == TenGod.BI_JIAN
                    ? properties.getPattern().getBiJianFallback()
                    : properties.getPattern().getJieCaiFallback();
            log.debug("regular pattern fallback: {} ({})", name, basis);
            return regular(name, primaryGod, basis, true);
        }

        TenGod tenGod = primaryGod;
        if (properties.getPattern().isProtrudingStemSelection()) {
            Optional<Stem> protruding = protrudingStem(chart);
            if (protruding.isPresent() && protruding.get() != primary) {
                tenGod = tenGodResolver.resolve(dm, protruding.get());
                basis = "月令" + month + "藏干" + protruding.get() + "透出";
            }
        }

        String name = REGULAR_NAMES.get(tenGod);
        if (name == null) {
            // 透出的中气/余气恰为比劫，不成格，仍按本气取
            tenGod = primaryGod;
            name = REGULAR_NAMES.get(primaryGod);
            basis = "月令" + month + "本气" + primary;
        }
        log.debug("regular pattern: {} via {} ({})", name, tenGod, basis);
        return regular(name, tenGod, basis, false);
    }

    private static PatternResult regular(String name, TenGod tenGod, String basis, boolean fallback) {
        return PatternResult.builder()
                .name(name)
                .kind(PatternKind.REGULAR)
                .family(REGULAR_FAMILY)
                .basis(basis + "为" + tenGod.getLabel())
                .tenGod(tenGod)
                .fallback(fallback)
                .build();
    }

    /**
     * 月令藏干按本气、中气、余气依次查是否透于年、月、时干。
     */
    private Optional<Stem> protrudingStem(Chart chart) {
        List<Stem> visible = List.of(chart.getYear().stem(), chart.getMonth().stem(), chart.getHour().stem());
        return chart.getMonth().branch().getHiddenStems().stream()
                .map(HiddenStem::stem)
                .filter(visible::contains)
                .findFirst();
    }
}
