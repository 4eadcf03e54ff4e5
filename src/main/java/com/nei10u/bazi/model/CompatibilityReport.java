package com.nei10u.bazi.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 合盘结果
 */
@Value
@Builder
public class CompatibilityReport {

    @Singular
    List<String> details;
    int score;
}
