package com.nei10u.bazi.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PatternResult {

    String name;          // 格局名，如 七杀格 / 井栏叉马格
    PatternKind kind;
    String family;        // 特殊格局所属类别；普通格局为 "正格"
    String basis;         // 取格依据
    TenGod tenGod;        // 普通格局所取十神；特殊格局为 null
    boolean fallback;     // 月令本气为比劫时的兜底格名
}
