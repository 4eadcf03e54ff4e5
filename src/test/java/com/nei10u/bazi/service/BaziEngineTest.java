package com.nei10u.bazi.service;

import com.nei10u.bazi.config.BaziEngineProperties;
import com.nei10u.bazi.model.Chart;
import com.nei10u.bazi.model.ChartAnalysis;
import com.nei10u.bazi.model.Gender;
import com.nei10u.bazi.model.InvalidChartException;
import com.nei10u.bazi.model.PatternKind;
import com.nei10u.bazi.model.Season;
import com.nei10u.bazi.model.StrengthLabel;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BaziEngineTest {

    private final BaziEngineProperties properties = new BaziEngineProperties();
    private final TenGodResolver tenGodResolver = new TenGodResolver();
    private final BaziEngine engine = new BaziEngine(
            tenGodResolver,
            new PatternClassifier(tenGodResolver, properties),
            new StrengthScorer(tenGodResolver, properties),
            new BranchInteractionResolver(),
            new AuxiliaryResolver(),
            new SeasonalAdjuster(),
            properties);

    @Test
    void analyze_shouldFillEveryStage() {
        Chart chart = Chart.of("甲子", "丙寅", "庚午", "丁亥", Gender.MALE);
        ChartAnalysis analysis = engine.analyze(chart);

        assertEquals(chart, analysis.getChart());
        assertNotNull(analysis.getTenGods());
        assertEquals("偏财格", analysis.getPattern().getName());
        assertEquals(PatternKind.REGULAR, analysis.getPattern().getKind());
        assertEquals(StrengthLabel.WEAK, analysis.getStrength().getLabel());
        assertNotNull(analysis.getInteractions());
        assertNotNull(analysis.getAuxiliary());
        assertEquals(Season.BALANCED, analysis.getSeasonal().getSeason());
    }

    @Test
    void analyze_shouldBeDeterministic() {
        Chart chart = Chart.of("壬申", "壬子", "庚辰", "丙子", Gender.FEMALE);

        assertEquals(engine.analyze(chart), engine.analyze(chart));
    }

    @Test
    void analyze_shouldCarryWinterNeedAndSpecialPattern() {
        ChartAnalysis analysis = engine.analyze(Chart.of("壬申", "壬子", "庚辰", "丙子", Gender.FEMALE));

        assertEquals("井栏叉马格", analysis.getPattern().getName());
        assertTrue(analysis.getSeasonal().isUrgent());
        assertEquals(Season.WINTER, analysis.getSeasonal().getSeason());
    }

    @Test
    void analyze_shouldRejectNullChart() {
        assertThrows(InvalidChartException.class, () -> engine.analyze(null));
    }
}
