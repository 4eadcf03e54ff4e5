package com.nei10u.bazi.model;

/**
 * 地支互动类别，rank 越大力量越强。六冲与合局并列上报，不相抵消。
 */
public enum InteractionKind {
    ASSEMBLY("三会", 5),
    HARMONY3("三合", 4),
    HARMONY6("六合", 3),
    HALF_HARMONY3("半合", 2),
    CLASH6("六冲", 3);

    private final String label;
    private final int rank;

    InteractionKind(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    public String getLabel() {
        return label;
    }

    public int getRank() {
        return rank;
    }
}
