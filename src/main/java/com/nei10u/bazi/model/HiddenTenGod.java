package com.nei10u.bazi.model;

/**
 * 藏干十神。position 为藏干序号：0 本气，1 中气，2 余气。
 */
public record HiddenTenGod(PillarRole role, int position, Stem stem, int weight, TenGod tenGod) {
}
