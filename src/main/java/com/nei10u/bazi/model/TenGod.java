package com.nei10u.bazi.model;

/**
 * 十神
 */
public enum TenGod {
    BI_JIAN("比肩"),     // 同五行同阴阳
    JIE_CAI("劫财"),     // 同五行异阴阳
    SHI_SHEN("食神"),    // 我生，同性
    SHANG_GUAN("伤官"),  // 我生，异性
    PIAN_CAI("偏财"),    // 我克，同性
    ZHENG_CAI("正财"),   // 我克，异性
    QI_SHA("七杀"),      // 克我，同性
    ZHENG_GUAN("正官"),  // 克我，异性
    PIAN_YIN("偏印"),    // 生我，同性
    ZHENG_YIN("正印");   // 生我，异性

    private final String label;

    TenGod(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * 比劫
     */
    public boolean isPeer() {
        return this == BI_JIAN || this == JIE_CAI;
    }

    /**
     * 印枭
     */
    public boolean isResource() {
        return this == PIAN_YIN || this == ZHENG_YIN;
    }

    @Override
    public String toString() {
        return label;
    }
}
