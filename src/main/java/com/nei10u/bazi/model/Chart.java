package com.nei10u.bazi.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 四柱命盘。构造即校验：四柱齐全且各居其位，性别必填。
 */
public final class Chart {

    private final Map<PillarRole, Pillar> pillars;
    private final Gender gender;

    public Chart(List<Pillar> pillars, Gender gender) {
        if (pillars == null || pillars.size() != PillarRole.values().length) {
            throw new InvalidChartException("四柱数量必须为 4");
        }
        if (gender == null) {
            throw new InvalidChartException("缺少性别");
        }
        EnumMap<PillarRole, Pillar> byRole = new EnumMap<>(PillarRole.class);
        for (Pillar p : pillars) {
            if (p == null) {
                throw new InvalidChartException("存在空柱");
            }
            if (byRole.put(p.role(), p) != null) {
                throw new InvalidChartException("重复的" + p.role().getLabel() + "柱");
            }
        }
        this.pillars = Collections.unmodifiableMap(byRole);
        this.gender = gender;
    }

    public static Chart of(String year, String month, String day, String hour, Gender gender) {
        return new Chart(List.of(
                Pillar.parse(year, PillarRole.YEAR),
                Pillar.parse(month, PillarRole.MONTH),
                Pillar.parse(day, PillarRole.DAY),
                Pillar.parse(hour, PillarRole.HOUR)
        ), gender);
    }

    public Pillar pillar(PillarRole role) {
        return pillars.get(role);
    }

    public Pillar getYear() {
        return pillars.get(PillarRole.YEAR);
    }

    public Pillar getMonth() {
        return pillars.get(PillarRole.MONTH);
    }

    public Pillar getDay() {
        return pillars.get(PillarRole.DAY);
    }

    public Pillar getHour() {
        return pillars.get(PillarRole.HOUR);
    }

    public Gender getGender() {
        return gender;
    }

    /**
     * 日主 = 日柱天干
     */
    public Stem getDayMaster() {
        return getDay().stem();
    }

    /**
     * 按 年、月、日、时 顺序
     */
    public List<Pillar> getPillars() {
        return List.copyOf(pillars.values());
    }

    public List<Stem> getStems() {
        return getPillars().stream().map(Pillar::stem).toList();
    }

    public List<Branch> getBranches() {
        return getPillars().stream().map(Pillar::branch).toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Chart other)) {
            return false;
        }
        return pillars.equals(other.pillars) && gender == other.gender;
    }

    @Override
    public int hashCode() {
        return 31 * pillars.hashCode() + gender.hashCode();
    }

    @Override
    public String toString() {
        return getYear() + " " + getMonth() + " " + getDay() + " " + getHour() + " (" + gender.getLabel() + ")";
    }
}
