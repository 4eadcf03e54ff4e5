package com.nei10u.bazi.model;

/**
 * 地支藏干。weight 以 10 为满分：本气独存 10，两气 7/3，三气 6/3/1。
 */
public record HiddenStem(Stem stem, int weight) {

    public static final int WEIGHT_SCALE = 10;
}
