package com.nei10u.bazi.model;

/**
 * 十二长生，按循环顺序排列
 */
public enum TwelveStage {
    CHANG_SHENG("长生"),
    MU_YU("沐浴"),
    GUAN_DAI("冠带"),
    LIN_GUAN("临官"),
    DI_WANG("帝旺"),
    SHUAI("衰"),
    BING("病"),
    SI("死"),
    MU("墓"),
    JUE("绝"),
    TAI("胎"),
    YANG("养");

    private final String label;

    TwelveStage(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
