package com.nei10u.bazi.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 引擎可调参数，对应 application.properties 中 bazi.engine.* 。
 * 默认值即规则书口径，不配置也能直接 new 出来使用。
 */
@Data
@ConfigurationProperties(prefix = "bazi.engine")
public class BaziEngineProperties {

    /** 十神是否计算藏干 */
    private boolean includeHiddenTenGods = true;

    private Pattern pattern = new Pattern();

    private Strength strength = new Strength();

    @Data
    public static class Pattern {
        /** 透干取格：月令中气/余气透出天干时改取透出者；关闭时只看本气 */
        private boolean protrudingStemSelection = false;
        /** 月令本气为比肩时的格名 */
        private String biJianFallback = "建禄格";
        /** 月令本气为劫财时的格名 */
        private String jieCaiFallback = "羊刃格";
    }

    @Data
    public static class Strength {
        /** 得令阈值 */
        private int inSeasonThreshold = 38;
        /** 失令阈值 */
        private int outOfSeasonThreshold = 48;

        // 以下权重合计 100：月令 40，其余六位共 60
        private int monthBranch = 40;
        private int yearStem = 6;
        private int monthStem = 12;
        private int hourStem = 10;
        private int yearBranch = 6;
        private int dayBranch = 16;
        private int hourBranch = 10;
    }
}
