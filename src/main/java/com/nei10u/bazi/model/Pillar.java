package com.nei10u.bazi.model;

/**
 * 单柱：天干 + 地支 + 所在位置
 */
public record Pillar(Stem stem, Branch branch, PillarRole role) {

    public Pillar {
        if (stem == null || branch == null || role == null) {
            throw new InvalidChartException("柱信息不完整: " + stem + branch + " / " + role);
        }
        // 六十甲子中只有阳干配阳支、阴干配阴支
        if (stem.getPolarity() != branch.getPolarity()) {
            throw new InvalidChartException(role.getLabel() + "柱 " + stem + branch + " 不在六十甲子之内");
        }
    }

    /**
     * 解析 "甲子" 形式的两字干支。
     */
    public static Pillar parse(String ganZhi, PillarRole role) {
        if (ganZhi == null || ganZhi.length() != 2) {
            throw new InvalidChartException((role == null ? "" : role.getLabel() + "柱") + "格式错误: " + ganZhi);
        }
        return new Pillar(Stem.fromSymbol(ganZhi.substring(0, 1)), Branch.fromSymbol(ganZhi.substring(1, 2)), role);
    }

    /**
     * 六十甲子序号，甲子为 0，癸亥为 59。
     */
    public int cycleIndex() {
        return Math.floorMod(6 * stem.ordinal() - 5 * branch.ordinal(), 60);
    }

    public String ganZhi() {
        return stem.getSymbol() + branch.getSymbol();
    }

    @Override
    public String toString() {
        return ganZhi();
    }
}
