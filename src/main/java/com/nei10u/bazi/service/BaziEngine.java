package com.nei10u.bazi.service;

import com.nei10u.bazi.config.BaziEngineProperties;
import com.nei10u.bazi.model.Chart;
import com.nei10u.bazi.model.ChartAnalysis;
import com.nei10u.bazi.model.InvalidChartException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 排盘分析流水线：十神 → 格局 → 强弱 → 地支作用 → 辅助信息 → 调候。
 * 每一步只读前面阶段的结果，并返回新的 {@link ChartAnalysis}。
 */
@Service
@RequiredArgsConstructor
public class BaziEngine {

    private static final Logger log = LoggerFactory.getLogger(BaziEngine.class);

    private final TenGodResolver tenGodResolver;
    private final PatternClassifier patternClassifier;
    private final StrengthScorer strengthScorer;
    private final BranchInteractionResolver interactionResolver;
    private final AuxiliaryResolver auxiliaryResolver;
    private final SeasonalAdjuster seasonalAdjuster;
    private final BaziEngineProperties properties;

    public ChartAnalysis analyze(Chart chart) {
        if (chart == null) {
            throw new InvalidChartException("命盘为空");
        }
        long start = System.currentTimeMillis();
        ChartAnalysis analysis = ChartAnalysis.builder().chart(chart).build();

        // 关闭藏干时，格局和强弱会就地按日主重新推算藏干十神
        analysis = analysis.toBuilder()
                .tenGods(tenGodResolver.profile(chart, properties.isIncludeHiddenTenGods()))
                .build();
        log.debug("[{}] ten gods: {}", chart, analysis.getTenGods().getStems());

        analysis = analysis.toBuilder()
                .pattern(patternClassifier.classify(chart, analysis.getTenGods()))
                .build();
        log.debug("[{}] pattern: {}", chart, analysis.getPattern().getName());

        analysis = analysis.toBuilder()
                .strength(strengthScorer.score(chart, analysis.getTenGods()))
                .build();
        log.debug("[{}] strength: {} {}", chart, analysis.getStrength().getLabel(), analysis.getStrength().getScore());

        analysis = analysis.toBuilder()
                .interactions(interactionResolver.resolve(chart))
                .build();
        log.debug("[{}] interactions: {}", chart, analysis.getInteractions().getInteractions().size());

        analysis = analysis.toBuilder()
                .auxiliary(auxiliaryResolver.resolve(chart))
                .build();
        log.debug("[{}] auxiliary: void={}", chart, analysis.getAuxiliary().getVoidBranches());

        analysis = analysis.toBuilder()
                .seasonal(seasonalAdjuster.adjust(chart.getDayMaster(), chart.getMonth().branch()))
                .build();
        log.debug("[{}] seasonal: {}", chart, analysis.getSeasonal().getSeason());

        log.info("[{}] analyze done in {}ms: {} / {}", chart, System.currentTimeMillis() - start,
                analysis.getPattern().getName(), analysis.getStrength().getLabel().getLabel());
        return analysis;
    }
}
