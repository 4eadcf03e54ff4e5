package com.nei10u.bazi.service;

import com.nei10u.bazi.model.Chart;
import com.nei10u.bazi.model.CompatibilityReport;
import com.nei10u.bazi.model.Gender;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompatibilityResolverTest {

    private final CompatibilityResolver resolver = new CompatibilityResolver();

    private final Chart jiaZi = Chart.of("甲子", "丙寅", "甲子", "丙寅", Gender.MALE);

    @Test
    void match_shouldRewardStemCombineAndBranchHarmony() {
        Chart jiChou = Chart.of("己丑", "丁丑", "己丑", "乙丑", Gender.FEMALE);
        CompatibilityReport report = resolver.match(jiaZi, jiChou);

        assertEquals(110, report.getScore());
        assertEquals(2, report.getDetails().size());
        assertTrue(report.getDetails().get(0).contains("甲己合化土"));
    }

    @Test
    void match_shouldPenaliseDayBranchClash() {
        Chart gengWu = Chart.of("庚午", "戊寅", "庚午", "丙子", Gender.FEMALE);
        CompatibilityReport report = resolver.match(jiaZi, gengWu);

        assertEquals(50, report.getScore());
        assertTrue(report.getDetails().get(0).contains("子午相冲"));
    }

    @Test
    void match_shouldStayAtBaseWhenNothingRelates() {
        Chart bingYin = Chart.of("丙寅", "庚寅", "丙寅", "戊子", Gender.FEMALE);
        CompatibilityReport report = resolver.match(jiaZi, bingYin);

        assertEquals(CompatibilityResolver.BASE_SCORE, report.getScore());
        assertTrue(report.getDetails().isEmpty());
    }
}
