package com.nei10u.bazi.rule;

/**
 * 目标五行相对参照五行的生克关系
 */
public enum ElementRelation {
    SAME,           // 同我
    GENERATES,      // 我生
    CONTROLS,       // 我克
    CONTROLLED_BY,  // 克我
    GENERATED_BY    // 生我
}
