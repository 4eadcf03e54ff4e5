package com.nei10u.bazi.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 大运排盘结果
 */
@Value
@Builder
public class Fortune {

    Chart chart;
    boolean forward;        // 顺排：阳男阴女
    int startYears;         // 出生后几年几月几天起运
    int startMonths;
    int startDays;
    String startDate;       // 起运公历日期 yyyy-MM-dd
    List<FortuneCycle> cycles;
}
