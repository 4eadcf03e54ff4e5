package com.nei10u.bazi.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class BranchInteractions {

    /** 按力量降序，同级保持检测顺序；同一地支可同时出现在多条关系中 */
    List<Interaction> interactions;

    /** 各柱地支藏干 */
    Map<PillarRole, List<HiddenStem>> hiddenStems;

    public List<Interaction> ofKind(InteractionKind kind) {
        return interactions.stream().filter(i -> i.kind() == kind).toList();
    }

    public boolean has(InteractionKind kind) {
        return interactions.stream().anyMatch(i -> i.kind() == kind);
    }
}
