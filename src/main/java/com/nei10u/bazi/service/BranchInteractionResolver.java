package com.nei10u.bazi.service;

import com.nei10u.bazi.model.Branch;
import com.nei10u.bazi.model.BranchInteractions;
import com.nei10u.bazi.model.Chart;
import com.nei10u.bazi.model.HiddenStem;
import com.nei10u.bazi.model.Interaction;
import com.nei10u.bazi.model.InteractionKind;
import com.nei10u.bazi.model.Pillar;
import com.nei10u.bazi.model.PillarRole;
import com.nei10u.bazi.rule.CombinationTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 地支三会、三合（含半合）、六合、六冲。各类关系互不排斥，全部上报。
 */
@Service
public class BranchInteractionResolver {

    private static final Logger log = LoggerFactory.getLogger(BranchInteractionResolver.class);

    public BranchInteractions resolve(Chart chart) {
        Map<PillarRole, List<HiddenStem>> hidden = new EnumMap<>(PillarRole.class);
        for (Pillar p : chart.getPillars()) {
            hidden.put(p.role(), p.branch().getHiddenStems());
        }
        List<Interaction> interactions = detect(chart.getBranches());
        log.debug("branch interactions for {}: {}", chart, interactions.size());
        return BranchInteractions.builder()
                .interactions(interactions)
                .hiddenStems(Collections.unmodifiableMap(hidden))
                .build();
    }

    /**
     * 只看地支集合，与柱序无关。
     */
    public List<Interaction> detect(Collection<Branch> branches) {
        Set<Branch> present = branches.isEmpty() ? EnumSet.noneOf(Branch.class) : EnumSet.copyOf(branches);
        List<Interaction> found = new ArrayList<>();

        for (CombinationTables.Trio trio : CombinationTables.ASSEMBLIES) {
            if (present.containsAll(trio.members())) {
                found.add(new Interaction(InteractionKind.ASSEMBLY, ordered(trio.members()), trio.element(), trio.name()));
            }
        }

        for (CombinationTables.Trio trio : CombinationTables.HARMONY_TRIOS) {
            Set<Branch> hit = EnumSet.noneOf(Branch.class);
            for (Branch b : trio.members()) {
                if (present.contains(b)) {
                    hit.add(b);
                }
            }
            if (hit.size() == 3) {
                found.add(new Interaction(InteractionKind.HARMONY3, ordered(hit), trio.element(), trio.name()));
            } else if (hit.size() == 2) {
                // 三缺一：半合，力量弱于全局；补齐第三支即升为三合
                List<Branch> pair = ordered(hit);
                String name = pair.get(0).getSymbol() + pair.get(1).getSymbol() + "半合" + trio.element().getLabel() + "局";
                found.add(new Interaction(InteractionKind.HALF_HARMONY3, pair, trio.element(), name));
            }
        }

        for (CombinationTables.Pair pair : CombinationTables.SIX_HARMONIES) {
            if (pair.presentIn(present)) {
                found.add(new Interaction(InteractionKind.HARMONY6, List.of(pair.first(), pair.second()), pair.element(), pair.name()));
            }
        }

        for (CombinationTables.Pair pair : CombinationTables.SIX_CLASHES) {
            if (pair.presentIn(present)) {
                found.add(new Interaction(InteractionKind.CLASH6, List.of(pair.first(), pair.second()), null, pair.name()));
            }
        }

        // List.sort 为稳定排序，同级保持检测顺序
        found.sort(Comparator.comparingInt(Interaction::rank).reversed());
        return List.copyOf(found);
    }

    private static List<Branch> ordered(Set<Branch> members) {
        return members.stream().sorted().toList();
    }
}
