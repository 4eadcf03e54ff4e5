package com.nei10u.bazi.service;

import com.nei10u.bazi.model.Chart;
import com.nei10u.bazi.model.HiddenStem;
import com.nei10u.bazi.model.HiddenTenGod;
import com.nei10u.bazi.model.Pillar;
import com.nei10u.bazi.model.Stem;
import com.nei10u.bazi.model.TenGod;
import com.nei10u.bazi.model.TenGodProfile;
import com.nei10u.bazi.rule.ElementCycle;
import com.nei10u.bazi.rule.ElementRelation;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 十神计算：先定五行生克，再按阴阳同异一分为二。
 */
@Service
public class TenGodResolver {

    /** [日主][目标]，类加载时一次性建好 */
    private static final TenGod[][] TABLE = new TenGod[Stem.values().length][Stem.values().length];

    private static final Map<ElementRelation, TenGod[]> BY_RELATION = new EnumMap<>(ElementRelation.class);

    static {
        // {同性, 异性}
        BY_RELATION.put(ElementRelation.SAME, new TenGod[]{TenGod.BI_JIAN, TenGod.JIE_CAI});
        BY_RELATION.put(ElementRelation.GENERATES, new TenGod[]{TenGod.SHI_SHEN, TenGod.SHANG_GUAN});
        BY_RELATION.put(ElementRelation.CONTROLS, new TenGod[]{TenGod.PIAN_CAI, TenGod.ZHENG_CAI});
        BY_RELATION.put(ElementRelation.CONTROLLED_BY, new TenGod[]{TenGod.QI_SHA, TenGod.ZHENG_GUAN});
        BY_RELATION.put(ElementRelation.GENERATED_BY, new TenGod[]{TenGod.PIAN_YIN, TenGod.ZHENG_YIN});

        for (Stem dm : Stem.values()) {
            for (Stem target : Stem.values()) {
                ElementRelation rel = ElementCycle.relation(dm.getElement(), target.getElement());
                int idx = dm.getPolarity() == target.getPolarity() ? 0 : 1;
                TABLE[dm.ordinal()][target.ordinal()] = BY_RELATION.get(rel)[idx];
            }
        }
    }

    public TenGod resolve(Stem dayMaster, Stem target) {
        return TABLE[dayMaster.ordinal()][target.ordinal()];
    }

    /**
     * 整盘十神。日干自身记为比肩。
     *
     * @param includeHidden 是否同时计算各支藏干
     */
    public TenGodProfile profile(Chart chart, boolean includeHidden) {
        Stem dm = chart.getDayMaster();
        TenGodProfile.TenGodProfileBuilder builder = TenGodProfile.builder().dayMaster(dm);
        for (Pillar p : chart.getPillars()) {
            builder.stem(p.role(), resolve(dm, p.stem()));
            if (includeHidden) {
                List<HiddenStem> hiddenStems = p.branch().getHiddenStems();
                List<HiddenTenGod> list = new ArrayList<>(hiddenStems.size());
                for (int i = 0; i < hiddenStems.size(); i++) {
                    HiddenStem h = hiddenStems.get(i);
                    list.add(new HiddenTenGod(p.role(), i, h.stem(), h.weight(), resolve(dm, h.stem())));
                }
                builder.hidden(p.role(), List.copyOf(list));
            }
        }
        return builder.build();
    }
}
