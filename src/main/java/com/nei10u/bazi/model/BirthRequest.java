package com.nei10u.bazi.model;

import lombok.Data;

/**
 * 出生时刻（公历，北京时间）
 */
@Data
public class BirthRequest {
    private int year;
    private int month;
    private int day;
    private int hour;
    private int minute;
    private String gender;    // "男" or "女"
    private Double longitude; // 经度，用于真太阳时校正，可选
}
