package com.nei10u.bazi.service;

import com.nei10u.bazi.config.BaziEngineProperties;
import com.nei10u.bazi.model.Chart;
import com.nei10u.bazi.model.Element;
import com.nei10u.bazi.model.HiddenStem;
import com.nei10u.bazi.model.Pillar;
import com.nei10u.bazi.model.PillarRole;
import com.nei10u.bazi.model.StrengthLabel;
import com.nei10u.bazi.model.StrengthResult;
import com.nei10u.bazi.model.TenGod;
import com.nei10u.bazi.model.TenGodProfile;
import com.nei10u.bazi.rule.ElementCycle;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 身强身弱：加权打分法。
 *
 * <p>同我（比劫）与生我（印枭）计入同党分。月令占 40，其余六个位置共 60，地支按藏干权重摊分。
 * 得令阈值 38，失令阈值 48，得分 &gt;= 阈值即身旺。为保证阈值边界精确，内部以 1/10 分为单位整数累加。</p>
 */
@Service
@RequiredArgsConstructor
public class StrengthScorer {

    private static final Logger log = LoggerFactory.getLogger(StrengthScorer.class);

    private final TenGodResolver tenGodResolver;
    private final BaziEngineProperties properties;

    public StrengthResult score(Chart chart, TenGodProfile tenGods) {
        BaziEngineProperties.Strength w = properties.getStrength();

        int tenths = 0;
        // 日干是日主自身，不计分
        tenths += stemTenths(chart, tenGods, PillarRole.YEAR, w.getYearStem());
        tenths += stemTenths(chart, tenGods, PillarRole.MONTH, w.getMonthStem());
        tenths += stemTenths(chart, tenGods, PillarRole.HOUR, w.getHourStem());
        tenths += branchTenths(chart, tenGods, PillarRole.YEAR, w.getYearBranch());
        tenths += branchTenths(chart, tenGods, PillarRole.MONTH, w.getMonthBranch());
        tenths += branchTenths(chart, tenGods, PillarRole.DAY, w.getDayBranch());
        tenths += branchTenths(chart, tenGods, PillarRole.HOUR, w.getHourBranch());

        Element dm = chart.getDayMaster().getElement();
        Element resource = ElementCycle.generatedBy(dm);
        Element monthElement = chart.getMonth().branch().getElement();
        boolean inSeason = monthElement == dm || monthElement == resource;
        int threshold = inSeason ? w.getInSeasonThreshold() : w.getOutOfSeasonThreshold();

        boolean strong = tenths >= threshold * HiddenStem.WEIGHT_SCALE;
        double score = tenths / (double) HiddenStem.WEIGHT_SCALE;

        List<Element> favorable;
        List<Element> unfavorable;
        if (strong) {
            // 身强喜克泄：官杀、食伤
            favorable = List.of(ElementCycle.controlledBy(dm), ElementCycle.generates(dm));
            unfavorable = List.of(dm, resource);
        } else {
            // 身弱喜生扶：比劫、印枭
            favorable = List.of(dm, resource);
            unfavorable = List.of(ElementCycle.controlledBy(dm), ElementCycle.generates(dm), ElementCycle.controls(dm));
        }

        String detail = String.format("同党得分: %s, 判定阈值: %d (%s)",
                formatScore(score), threshold, inSeason ? "得令" : "失令");
        log.debug("strength {} -> {} {}", chart, strong ? "strong" : "weak", detail);

        return StrengthResult.builder()
                .label(strong ? StrengthLabel.STRONG : StrengthLabel.WEAK)
                .score(score)
                .threshold(threshold)
                .inSeason(inSeason)
                .favorable(favorable)
                .unfavorable(unfavorable)
                .detail(detail)
                .build();
    }

    private int stemTenths(Chart chart, TenGodProfile tenGods, PillarRole role, int weight) {
        TenGod god = tenGods != null && tenGods.stem(role) != null
                ? tenGods.stem(role)
                : tenGodResolver.resolve(chart.getDayMaster(), chart.pillar(role).stem());
        return isSelfParty(god) ? weight * HiddenStem.WEIGHT_SCALE : 0;
    }

    private int branchTenths(Chart chart, TenGodProfile tenGods, PillarRole role, int weight) {
        Pillar pillar = chart.pillar(role);
        List<HiddenStem> hidden = pillar.branch().getHiddenStems();
        int sum = 0;
        for (int i = 0; i < hidden.size(); i++) {
            HiddenStem h = hidden.get(i);
            TenGod god = tenGods == null ? null : tenGods.hidden(role, i).map(t -> t.tenGod()).orElse(null);
            if (god == null) {
                god = tenGodResolver.resolve(chart.getDayMaster(), h.stem());
            }
            if (isSelfParty(god)) {
                sum += weight * h.weight();
            }
        }
        return sum;
    }

    private static boolean isSelfParty(TenGod god) {
        return god.isPeer() || god.isResource();
    }

    private static String formatScore(double score) {
        return score == Math.rint(score) ? String.valueOf((long) score) : String.valueOf(score);
    }
}
