package com.nei10u.bazi.service;

import com.nei10u.bazi.model.AuxiliarySet;
import com.nei10u.bazi.model.Branch;
import com.nei10u.bazi.model.Chart;
import com.nei10u.bazi.model.Gender;
import com.nei10u.bazi.model.PairRelation;
import com.nei10u.bazi.model.PairRelationKind;
import com.nei10u.bazi.model.Pillar;
import com.nei10u.bazi.model.PillarRole;
import com.nei10u.bazi.model.Spirit;
import com.nei10u.bazi.model.Stem;
import com.nei10u.bazi.model.TwelveStage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuxiliaryResolverTest {

    private final AuxiliaryResolver resolver = new AuxiliaryResolver();

    @Test
    void stage_shouldRunForwardForYangAndBackwardForYin() {
        assertEquals(TwelveStage.CHANG_SHENG, resolver.stage(Stem.JIA, Branch.HAI));
        assertEquals(TwelveStage.DI_WANG, resolver.stage(Stem.JIA, Branch.MAO));
        assertEquals(TwelveStage.MU, resolver.stage(Stem.JIA, Branch.WEI));
        assertEquals(TwelveStage.CHANG_SHENG, resolver.stage(Stem.YI, Branch.WU));
        assertEquals(TwelveStage.MU_YU, resolver.stage(Stem.YI, Branch.SI));
        assertEquals(TwelveStage.DI_WANG, resolver.stage(Stem.YI, Branch.YIN));
    }

    @Test
    void voidBranches_shouldFollowXun() {
        assertEquals(List.of(Branch.XU, Branch.HAI), resolver.voidBranches(Pillar.parse("甲子", PillarRole.DAY)));
        assertEquals(List.of(Branch.XU, Branch.HAI), resolver.voidBranches(Pillar.parse("癸酉", PillarRole.DAY)));
        assertEquals(List.of(Branch.SHEN, Branch.YOU), resolver.voidBranches(Pillar.parse("甲戌", PillarRole.DAY)));
        assertEquals(List.of(Branch.ZI, Branch.CHOU), resolver.voidBranches(Pillar.parse("甲寅", PillarRole.DAY)));
    }

    @Test
    void naYin_shouldPairTwoPillarsPerSound() {
        assertEquals("海中金", resolver.naYin(Pillar.parse("甲子", PillarRole.YEAR)));
        assertEquals("海中金", resolver.naYin(Pillar.parse("乙丑", PillarRole.YEAR)));
        assertEquals("炉中火", resolver.naYin(Pillar.parse("丙寅", PillarRole.YEAR)));
        assertEquals("大海水", resolver.naYin(Pillar.parse("癸亥", PillarRole.YEAR)));
    }

    @Test
    void resolve_shouldCollectSpiritsAndPairRelations() {
        Chart chart = Chart.of("甲子", "丙寅", "甲戌", "乙丑", Gender.FEMALE);
        AuxiliarySet aux = resolver.resolve(chart);

        assertTrue(aux.hasSpirit("天乙贵人"));
        assertTrue(aux.hasSpirit("禄神"));
        assertTrue(aux.hasSpirit("国印"));
        // 月德以天干为目标：寅月见丙
        assertTrue(aux.hasSpirit("月德"));
        assertFalse(aux.hasSpirit("羊刃"));
        Spirit nobleman = aux.getSpirits().stream().filter(s -> s.name().equals("天乙贵人")).findFirst().orElseThrow();
        assertEquals(List.of("丑"), nobleman.targets());

        assertEquals(List.of(Branch.SHEN, Branch.YOU), aux.getVoidBranches());
        assertTrue(aux.getVoidedRoles().isEmpty());
        assertEquals(List.of(Branch.XU, Branch.HAI), aux.getPillarVoids().get(PillarRole.YEAR));
        assertEquals("山头火", aux.getNaYin().get(PillarRole.DAY));

        List<PairRelation> relations = aux.getPairRelations();
        assertEquals(2, relations.size());
        assertTrue(relations.stream().anyMatch(r -> r.kind() == PairRelationKind.COMBINE
                && r.between(PillarRole.YEAR, PillarRole.HOUR)));
        assertTrue(relations.stream().anyMatch(r -> r.kind() == PairRelationKind.PUNISH
                && r.between(PillarRole.DAY, PillarRole.HOUR)));
    }

    @Test
    void resolve_shouldFlagVoidedRolesAndSelfPunishment() {
        // 甲子日空戌亥，时支亥落空；年月辰辰自刑
        Chart chart = Chart.of("甲辰", "戊辰", "甲子", "乙亥", Gender.MALE);
        AuxiliarySet aux = resolver.resolve(chart);

        assertTrue(aux.getVoidedRoles().contains(PillarRole.HOUR));
        assertEquals(1, aux.getVoidedRoles().size());
        assertTrue(aux.getPairRelations().stream().anyMatch(r -> r.kind() == PairRelationKind.SELF_PUNISH
                && r.between(PillarRole.YEAR, PillarRole.MONTH)));
        assertEquals(TwelveStage.CHANG_SHENG, aux.getTwelveStages().get(PillarRole.HOUR));
    }

    @Test
    void resolve_shouldFindPeachBlossomAndPostHorseFromDayBranch() {
        // 子日：桃花在酉，驿马在寅
        AuxiliarySet aux = resolver.resolve(Chart.of("甲子", "癸酉", "甲子", "丙寅", Gender.MALE));

        assertEquals(List.of("酉"), spirit(aux, "桃花").targets());
        assertEquals(List.of("寅"), spirit(aux, "驿马").targets());
        assertEquals("日支", spirit(aux, "驿马").basis());
    }

    @Test
    void resolve_shouldMatchHeavenlyVirtueAgainstBranches() {
        // 卯月天德在申，目标是地支
        AuxiliarySet withShen = resolver.resolve(Chart.of("甲申", "丁卯", "甲子", "丙寅", Gender.MALE));
        assertEquals(List.of("申"), spirit(withShen, "天德").targets());

        AuxiliarySet withoutShen = resolver.resolve(Chart.of("甲午", "丁卯", "甲子", "丙寅", Gender.MALE));
        assertFalse(withoutShen.hasSpirit("天德"));

        // 子月天德在巳
        AuxiliarySet ziMonth = resolver.resolve(Chart.of("甲子", "丙子", "甲子", "己巳", Gender.MALE));
        assertEquals(List.of("巳"), spirit(ziMonth, "天德").targets());
    }

    private static Spirit spirit(AuxiliarySet aux, String name) {
        return aux.getSpirits().stream().filter(s -> s.name().equals(name)).findFirst().orElseThrow();
    }
}
