package com.nei10u.bazi.model;

import lombok.Builder;
import lombok.Value;

/**
 * 流水线产物。每一阶段在上一阶段的副本上补充自己的结果，未跑到的阶段为 null。
 */
@Value
@Builder(toBuilder = true)
public class ChartAnalysis {

    Chart chart;
    TenGodProfile tenGods;
    PatternResult pattern;
    StrengthResult strength;
    BranchInteractions interactions;
    AuxiliarySet auxiliary;
    SeasonalNeed seasonal;
}
