package com.nei10u.bazi.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 整盘十神：天干按柱位索引，藏干按 (柱位, 藏干序号) 索引。
 */
@Value
@Builder
public class TenGodProfile {

    Stem dayMaster;

    @Singular("stem")
    Map<PillarRole, TenGod> stems;

    /** 未请求藏干时为空 */
    @Singular("hidden")
    Map<PillarRole, List<HiddenTenGod>> hidden;

    public TenGod stem(PillarRole role) {
        return stems.get(role);
    }

    public Optional<HiddenTenGod> hidden(PillarRole role, int position) {
        List<HiddenTenGod> list = hidden.get(role);
        if (list == null || position < 0 || position >= list.size()) {
            return Optional.empty();
        }
        return Optional.of(list.get(position));
    }
}
