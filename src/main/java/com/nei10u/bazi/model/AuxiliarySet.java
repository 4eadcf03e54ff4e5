package com.nei10u.bazi.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

@Value
@Builder
public class AuxiliarySet {

    Map<PillarRole, TwelveStage> twelveStages;

    /** 日柱旬空，恰为两支 */
    List<Branch> voidBranches;

    /** 四柱各自的旬空 */
    Map<PillarRole, List<Branch>> pillarVoids;

    /** 地支落入日柱旬空的柱位 */
    Set<PillarRole> voidedRoles;

    List<Spirit> spirits;

    /** 六对地支的刑冲合害 */
    List<PairRelation> pairRelations;

    /** 纳音 */
    Map<PillarRole, String> naYin;

    public boolean hasSpirit(String name) {
        return spirits.stream().anyMatch(s -> s.name().equals(name));
    }
}
