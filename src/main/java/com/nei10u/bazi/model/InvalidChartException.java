package com.nei10u.bazi.model;

/**
 * 四柱输入不合法（干支越界、缺柱、阴阳错配等）。在任何计算开始前抛出。
 */
public class InvalidChartException extends IllegalArgumentException {

    public InvalidChartException(String message) {
        super(message);
    }
}
