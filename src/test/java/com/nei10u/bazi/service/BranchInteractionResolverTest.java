package com.nei10u.bazi.service;

import com.nei10u.bazi.model.Branch;
import com.nei10u.bazi.model.BranchInteractions;
import com.nei10u.bazi.model.Chart;
import com.nei10u.bazi.model.Element;
import com.nei10u.bazi.model.Gender;
import com.nei10u.bazi.model.Interaction;
import com.nei10u.bazi.model.InteractionKind;
import com.nei10u.bazi.model.PillarRole;
import com.nei10u.bazi.model.Stem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BranchInteractionResolverTest {

    private final BranchInteractionResolver resolver = new BranchInteractionResolver();

    @Test
    void resolve_shouldReportHarmonyAndClashTogether() {
        Chart chart = Chart.of("甲辰", "壬申", "丙子", "庚寅", Gender.MALE);
        BranchInteractions result = resolver.resolve(chart);
        List<Interaction> all = result.getInteractions();

        assertEquals(2, all.size());
        assertEquals(InteractionKind.HARMONY3, all.get(0).kind());
        assertEquals(Element.WATER, all.get(0).element());
        assertEquals(List.of(Branch.ZI, Branch.CHEN, Branch.SHEN), all.get(0).branches());
        assertEquals(InteractionKind.CLASH6, all.get(1).kind());
        assertTrue(all.get(1).involves(Branch.SHEN));
        // 申同时参与三合与六冲
        assertTrue(all.get(0).involves(Branch.SHEN));
        assertFalse(result.has(InteractionKind.HALF_HARMONY3));
    }

    @Test
    void detect_shouldReportHalfHarmonyWhenTrioIncomplete() {
        List<Interaction> all = resolver.detect(List.of(Branch.ZI, Branch.CHEN, Branch.WU, Branch.WU));

        assertEquals(2, all.size());
        assertEquals(InteractionKind.CLASH6, all.get(0).kind());
        assertEquals("子午冲", all.get(0).name());
        assertEquals(InteractionKind.HALF_HARMONY3, all.get(1).kind());
        assertEquals("子辰半合水局", all.get(1).name());
    }

    @Test
    void detect_shouldRankAssemblyFirst() {
        List<Interaction> all = resolver.detect(List.of(Branch.HAI, Branch.ZI, Branch.CHOU, Branch.YIN));

        assertEquals(InteractionKind.ASSEMBLY, all.get(0).kind());
        assertEquals("北方水局", all.get(0).name());
        for (int i = 1; i < all.size(); i++) {
            assertTrue(all.get(i - 1).rank() >= all.get(i).rank());
        }
        // 子丑合、寅亥合同级，保持表中顺序
        List<Interaction> harmonies = all.stream().filter(i -> i.kind() == InteractionKind.HARMONY6).toList();
        assertEquals(List.of("子丑合土", "寅亥合木"), harmonies.stream().map(Interaction::name).toList());
    }

    @Test
    void detect_shouldReturnEmptyWhenNothingMatches() {
        assertTrue(resolver.detect(List.of(Branch.ZI, Branch.YIN, Branch.CHEN, Branch.WU)).stream()
                .noneMatch(i -> i.kind() == InteractionKind.ASSEMBLY || i.kind() == InteractionKind.HARMONY6));
        assertTrue(resolver.detect(List.of()).isEmpty());
    }

    @Test
    void resolve_shouldListHiddenStemsPerRole() {
        Chart chart = Chart.of("甲辰", "壬申", "丙子", "庚寅", Gender.MALE);
        BranchInteractions result = resolver.resolve(chart);

        assertEquals(Stem.GENG, result.getHiddenStems().get(PillarRole.MONTH).get(0).stem());
        assertEquals(1, result.getHiddenStems().get(PillarRole.DAY).size());
    }
}
