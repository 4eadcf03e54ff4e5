package com.nei10u.bazi.model;

/**
 * 两柱地支之间的一条刑冲合害关系
 */
public record PairRelation(PairRelationKind kind, PillarRole first, PillarRole second,
                           Branch firstBranch, Branch secondBranch, String name) {

    public boolean between(PillarRole a, PillarRole b) {
        return (first == a && second == b) || (first == b && second == a);
    }
}
