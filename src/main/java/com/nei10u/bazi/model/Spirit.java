package com.nei10u.bazi.model;

import java.util.List;

/**
 * 命中的神煞。targets 为盘中实际见到的干支符号。
 */
public record Spirit(String name, String basis, List<String> targets) {

    @Override
    public String toString() {
        return name + "(" + String.join("", targets) + ")";
    }
}
