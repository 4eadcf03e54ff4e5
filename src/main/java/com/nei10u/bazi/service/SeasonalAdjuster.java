package com.nei10u.bazi.service;

import com.nei10u.bazi.model.Branch;
import com.nei10u.bazi.model.Element;
import com.nei10u.bazi.model.Season;
import com.nei10u.bazi.model.SeasonalNeed;
import com.nei10u.bazi.model.Stem;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * 调候用神：冬寒需火，夏燥需水，春秋只论抑扶。
 */
@Service
public class SeasonalAdjuster {

    private static final Set<Branch> WINTER = Set.of(Branch.HAI, Branch.ZI, Branch.CHOU);
    private static final Set<Branch> SUMMER = Set.of(Branch.SI, Branch.WU, Branch.WEI);

    private record Advisory(String status, String needs, String advice) {
    }

    private static final Map<Element, Advisory> WINTER_ADVICE;
    private static final Map<Element, Advisory> SUMMER_ADVICE;

    static {
        Map<Element, Advisory> w = new EnumMap<>(Element.class);
        w.put(Element.WOOD, new Advisory("水冷木冻", "丙火 (太阳)", "寒木向阳，无火不发。首要取火暖局，防根基腐烂。"));
        w.put(Element.FIRE, new Advisory("火势气弱", "甲木 (引火)", "冬天的火容易熄灭，喜木来生火，同时需丙火比劫帮身抗寒。"));
        w.put(Element.EARTH, new Advisory("天地冻结", "丙火 (解冻)", "湿土冻土无法生金或栽木，急需火来解冻，才能恢复生机。"));
        w.put(Element.METAL, new Advisory("金寒水冷", "丁火/丙火", "水冷金寒，需要火来炼金或暖局，否则才华被冰封。"));
        w.put(Element.WATER, new Advisory("滴水成冰", "戊土 (止流) + 丙火 (暖局)", "冬水太旺且寒，需土制水，更需火来暖水。"));
        WINTER_ADVICE = Collections.unmodifiableMap(w);

        Map<Element, Advisory> s = new EnumMap<>(Element.class);
        s.put(Element.WOOD, new Advisory("木性枯焦", "癸水 (雨露)", "火旺泄木太过，木容易枯萎，急需水来滋润。"));
        s.put(Element.FIRE, new Advisory("炎火炎上", "壬水 (既济)", "火太旺则容易自焚，喜水来调节，水火既济。"));
        s.put(Element.EARTH, new Advisory("火炎土燥", "癸水 (润土)", "燥土不能生金，也不能种树，急需水来润土。"));
        s.put(Element.METAL, new Advisory("火熔金流", "壬水 (洗金) + 己土 (生金)", "金被火克太重，急需水来制火护金，或者湿土来生金。"));
        s.put(Element.WATER, new Advisory("水气干涸", "庚辛金 (发源) + 比劫", "夏天的水容易蒸发，需要金来生水，或者比劫帮身。"));
        SUMMER_ADVICE = Collections.unmodifiableMap(s);
    }

    private static final Advisory WINTER_GENERIC = new Advisory("寒", "火", "冬季万物休囚，首要取火暖局。");
    private static final Advisory SUMMER_GENERIC = new Advisory("燥", "水", "夏季火旺土燥，首要取水润局。");
    private static final Advisory BALANCED = new Advisory("气候平和", "依据强弱定喜用", "调候需求不明显，请主要参考五行强弱分析。");

    /**
     * 只按月令分季
     */
    public SeasonalNeed adjust(Branch monthBranch) {
        return adjust(null, monthBranch);
    }

    /**
     * 带日主时给出细化的调候说明；dayMaster 可为 null。
     */
    public SeasonalNeed adjust(Stem dayMaster, Branch monthBranch) {
        Element dm = dayMaster == null ? null : dayMaster.getElement();
        if (WINTER.contains(monthBranch)) {
            Advisory a = dm == null ? WINTER_GENERIC : WINTER_ADVICE.get(dm);
            return build(Season.WINTER, true, Element.FIRE, a);
        }
        if (SUMMER.contains(monthBranch)) {
            Advisory a = dm == null ? SUMMER_GENERIC : SUMMER_ADVICE.get(dm);
            return build(Season.SUMMER, true, Element.WATER, a);
        }
        return build(Season.BALANCED, false, null, BALANCED);
    }

    private static SeasonalNeed build(Season season, boolean urgent, Element element, Advisory a) {
        return SeasonalNeed.builder()
                .season(season)
                .urgent(urgent)
                .neededElement(element)
                .status(a.status())
                .needs(a.needs())
                .advice(a.advice())
                .build();
    }
}
