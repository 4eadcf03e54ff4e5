package com.nei10u.bazi.model;

import java.util.List;

/**
 * 一条地支互动。element 为会/合所成五行，六冲为 null。
 */
public record Interaction(InteractionKind kind, List<Branch> branches, Element element, String name) {

    public int rank() {
        return kind.getRank();
    }

    public boolean involves(Branch branch) {
        return branches.contains(branch);
    }
}
