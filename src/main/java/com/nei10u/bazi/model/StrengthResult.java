package com.nei10u.bazi.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class StrengthResult {

    StrengthLabel label;
    double score;            // 同党得分，满分 100
    int threshold;
    boolean inSeason;        // 得令
    List<Element> favorable;
    List<Element> unfavorable;
    String detail;

    public boolean isStrong() {
        return label == StrengthLabel.STRONG;
    }
}
