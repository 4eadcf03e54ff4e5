package com.nei10u.bazi.service;

import com.nei10u.bazi.model.Branch;
import com.nei10u.bazi.model.Chart;
import com.nei10u.bazi.model.CompatibilityReport;
import com.nei10u.bazi.model.Element;
import com.nei10u.bazi.model.Stem;
import com.nei10u.bazi.rule.CombinationTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 合盘：只看两人日柱。日干五合、日支六合加分，日支六冲减分。
 */
@Service
public class CompatibilityResolver {

    private static final Logger log = LoggerFactory.getLogger(CompatibilityResolver.class);

    public static final int BASE_SCORE = 60;
    public static final int STEM_COMBINE_BONUS = 30;
    public static final int BRANCH_HARMONY_BONUS = 20;
    public static final int BRANCH_CLASH_PENALTY = 10;

    public CompatibilityReport match(Chart a, Chart b) {
        Stem stemA = a.getDayMaster();
        Stem stemB = b.getDayMaster();
        Branch branchA = a.getDay().branch();
        Branch branchB = b.getDay().branch();

        CompatibilityReport.CompatibilityReportBuilder report = CompatibilityReport.builder();
        int score = BASE_SCORE;

        Optional<Element> combined = CombinationTables.stemCombine(stemA, stemB);
        if (combined.isPresent()) {
            report.detail("日干相合：" + stemA + stemB + "合化" + combined.get().getLabel() + "，心意相通");
            score += STEM_COMBINE_BONUS;
        }

        if (CombinationTables.find(CombinationTables.SIX_HARMONIES, branchA, branchB).isPresent()) {
            report.detail("日支六合：" + branchA + branchB + "相合，家庭和睦");
            score += BRANCH_HARMONY_BONUS;
        } else if (CombinationTables.find(CombinationTables.SIX_CLASHES, branchA, branchB).isPresent()) {
            report.detail("日支六冲：" + branchA + branchB + "相冲，易生摩擦");
            score -= BRANCH_CLASH_PENALTY;
        }

        log.debug("compatibility {} x {} -> {}", a, b, score);
        return report.score(score).build();
    }
}
