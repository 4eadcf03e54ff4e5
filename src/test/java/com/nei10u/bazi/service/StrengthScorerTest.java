package com.nei10u.bazi.service;

import com.nei10u.bazi.config.BaziEngineProperties;
import com.nei10u.bazi.model.Chart;
import com.nei10u.bazi.model.Element;
import com.nei10u.bazi.model.Gender;
import com.nei10u.bazi.model.StrengthLabel;
import com.nei10u.bazi.model.StrengthResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StrengthScorerTest {

    private final TenGodResolver tenGodResolver = new TenGodResolver();
    private final BaziEngineProperties properties = new BaziEngineProperties();
    private final StrengthScorer scorer = new StrengthScorer(tenGodResolver, properties);

    private StrengthResult score(String y, String m, String d, String h) {
        Chart chart = Chart.of(y, m, d, h, Gender.MALE);
        return scorer.score(chart, tenGodResolver.profile(chart, true));
    }

    @Test
    void score_shouldBeStrongExactlyAtInSeasonThreshold() {
        // 甲日寅月得令：时干甲 10 + 月令甲 40*0.6 + 时支辰中乙癸 10*0.4 = 38
        StrengthResult result = score("庚午", "丙寅", "甲戌", "甲辰");

        assertEquals(38.0, result.getScore(), 1e-9);
        assertEquals(38, result.getThreshold());
        assertTrue(result.isInSeason());
        assertEquals(StrengthLabel.STRONG, result.getLabel());
        assertEquals(List.of(Element.METAL, Element.FIRE), result.getFavorable());
        assertEquals(List.of(Element.WOOD, Element.WATER), result.getUnfavorable());
        assertTrue(result.getDetail().contains("得令"));
    }

    @Test
    void score_shouldBeWeakJustBelowThreshold() {
        // 时支换成丑，只剩癸 10*0.3
        StrengthResult result = score("庚午", "丙寅", "甲戌", "乙丑");

        assertEquals(37.0, result.getScore(), 1e-9);
        assertEquals(StrengthLabel.WEAK, result.getLabel());
        assertEquals(List.of(Element.WOOD, Element.WATER), result.getFavorable());
        assertEquals(List.of(Element.METAL, Element.FIRE, Element.EARTH), result.getUnfavorable());
    }

    @Test
    void score_shouldUseHigherThresholdOutOfSeason() {
        // 庚日寅月失令：月令戊 40*0.1 + 日支午中己 16*0.3 = 8.8
        StrengthResult result = score("甲子", "丙寅", "庚午", "丁亥");

        assertFalse(result.isInSeason());
        assertEquals(48, result.getThreshold());
        assertEquals(8.8, result.getScore(), 1e-9);
        assertEquals(StrengthLabel.WEAK, result.getLabel());
        assertTrue(result.getDetail().contains("失令"));
    }

    @Test
    void score_shouldCountResourceMonthAsInSeason() {
        // 甲日子月：子水生木，亦算得令
        StrengthResult result = score("甲子", "丙子", "甲子", "甲子");

        assertTrue(result.isInSeason());
        // 年干 6 + 时干 10 + 四支全是癸水 (6+40+16+10)
        assertEquals(88.0, result.getScore(), 1e-9);
        assertTrue(result.isStrong());
    }

    @Test
    void score_shouldWorkWithoutHiddenTenGods() {
        Chart chart = Chart.of("庚午", "丙寅", "甲戌", "甲辰", Gender.MALE);
        StrengthResult result = scorer.score(chart, tenGodResolver.profile(chart, false));

        assertEquals(38.0, result.getScore(), 1e-9);
    }
}
