package com.nei10u.bazi.model;

/**
 * 一步大运，十年一换。年份为公历，年龄为虚岁。
 */
public record FortuneCycle(int index, String ganZhi, int startYear, int endYear, int startAge, int endAge) {
}
