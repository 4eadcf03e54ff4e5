package com.nei10u.bazi.service;

import com.nei10u.bazi.model.AuxiliarySet;
import com.nei10u.bazi.model.Branch;
import com.nei10u.bazi.model.Chart;
import com.nei10u.bazi.model.PairRelation;
import com.nei10u.bazi.model.PairRelationKind;
import com.nei10u.bazi.model.Pillar;
import com.nei10u.bazi.model.PillarRole;
import com.nei10u.bazi.model.Polarity;
import com.nei10u.bazi.model.Spirit;
import com.nei10u.bazi.model.Stem;
import com.nei10u.bazi.model.TwelveStage;
import com.nei10u.bazi.rule.CombinationTables;
import com.nei10u.bazi.rule.SpiritTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 辅助信息：十二长生、空亡、神煞、地支刑冲合害、纳音。
 */
@Service
public class AuxiliaryResolver {

    private static final Logger log = LoggerFactory.getLogger(AuxiliaryResolver.class);

    /** 各天干长生之位。阳干顺行，阴干逆行 */
    private static final Map<Stem, Branch> CHANG_SHENG;

    static {
        Map<Stem, Branch> m = new EnumMap<>(Stem.class);
        m.put(Stem.JIA, Branch.HAI);
        m.put(Stem.BING, Branch.YIN);
        m.put(Stem.WU, Branch.YIN);
        m.put(Stem.GENG, Branch.SI);
        m.put(Stem.REN, Branch.SHEN);
        m.put(Stem.YI, Branch.WU);
        m.put(Stem.DING, Branch.YOU);
        m.put(Stem.JI, Branch.YOU);
        m.put(Stem.XIN, Branch.ZI);
        m.put(Stem.GUI, Branch.MAO);
        CHANG_SHENG = Collections.unmodifiableMap(m);
    }

    /** 六十甲子纳音，两柱一音 */
    private static final List<String> NA_YIN = List.of(
            "海中金", "炉中火", "大林木", "路旁土", "剑锋金", "山头火",
            "涧下水", "城头土", "白蜡金", "杨柳木", "泉中水", "屋上土",
            "霹雳火", "松柏木", "长流水", "沙中金", "山下火", "平地木",
            "壁上土", "金箔金", "覆灯火", "天河水", "大驿土", "钗钏金",
            "桑柘木", "大溪水", "沙中土", "天上火", "石榴木", "大海水");

    private static final Set<String> BRANCH_SYMBOLS = EnumSet.allOf(Branch.class).stream()
            .map(Branch::getSymbol)
            .collect(Collectors.toUnmodifiableSet());

    public AuxiliarySet resolve(Chart chart) {
        Stem dm = chart.getDayMaster();

        Map<PillarRole, TwelveStage> stages = new EnumMap<>(PillarRole.class);
        Map<PillarRole, List<Branch>> pillarVoids = new EnumMap<>(PillarRole.class);
        Map<PillarRole, String> naYin = new EnumMap<>(PillarRole.class);
        for (Pillar p : chart.getPillars()) {
            stages.put(p.role(), stage(dm, p.branch()));
            pillarVoids.put(p.role(), voidBranches(p));
            naYin.put(p.role(), naYin(p));
        }

        List<Branch> dayVoid = pillarVoids.get(PillarRole.DAY);
        Set<PillarRole> voided = EnumSet.noneOf(PillarRole.class);
        for (Pillar p : chart.getPillars()) {
            if (dayVoid.contains(p.branch())) {
                voided.add(p.role());
            }
        }

        AuxiliarySet result = AuxiliarySet.builder()
                .twelveStages(Collections.unmodifiableMap(stages))
                .voidBranches(dayVoid)
                .pillarVoids(Collections.unmodifiableMap(pillarVoids))
                .voidedRoles(Collections.unmodifiableSet(voided))
                .spirits(spirits(chart))
                .pairRelations(pairRelations(chart))
                .naYin(Collections.unmodifiableMap(naYin))
                .build();
        log.debug("auxiliary for {}: void={} spirits={}", chart, dayVoid, result.getSpirits());
        return result;
    }

    public TwelveStage stage(Stem dayMaster, Branch branch) {
        int start = CHANG_SHENG.get(dayMaster).ordinal();
        int steps = dayMaster.getPolarity() == Polarity.YANG
                ? branch.ordinal() - start
                : start - branch.ordinal();
        return TwelveStage.values()[Math.floorMod(steps, 12)];
    }

    /**
     * 旬空：甲子旬中戌亥空……取该旬之后缺配天干的两支。
     */
    public List<Branch> voidBranches(Pillar pillar) {
        int diff = pillar.branch().ordinal() - pillar.stem().ordinal();
        return List.of(Branch.byIndex(diff - 2), Branch.byIndex(diff - 1));
    }

    public String naYin(Pillar pillar) {
        return NA_YIN.get(pillar.cycleIndex() / 2);
    }

    List<Spirit> spirits(Chart chart) {
        Set<String> branches = chart.getBranches().stream().map(Branch::getSymbol).collect(Collectors.toSet());
        Set<String> stems = chart.getStems().stream().map(Stem::getSymbol).collect(Collectors.toSet());

        List<Spirit> found = new ArrayList<>();
        for (SpiritTables.SpiritRule rule : SpiritTables.RULES) {
            String key = switch (rule.basis()) {
                case DAY_STEM -> chart.getDayMaster().getSymbol();
                case DAY_BRANCH -> chart.getDay().branch().getSymbol();
                case MONTH_BRANCH -> chart.getMonth().branch().getSymbol();
                case YEAR_BRANCH -> chart.getYear().branch().getSymbol();
            };
            List<String> hits = rule.targetsOf(key).stream()
                    .filter(t -> BRANCH_SYMBOLS.contains(t) ? branches.contains(t) : stems.contains(t))
                    .toList();
            if (!hits.isEmpty()) {
                found.add(new Spirit(rule.name(), rule.basis().getLabel(), hits));
            }
        }
        return List.copyOf(found);
    }

    /**
     * C(4,2) 六对地支逐一比对冲、合、害、刑、自刑，一对可同时有多种关系。
     */
    List<PairRelation> pairRelations(Chart chart) {
        List<Pillar> pillars = chart.getPillars();
        List<PairRelation> relations = new ArrayList<>();
        for (int i = 0; i < pillars.size(); i++) {
            for (int j = i + 1; j < pillars.size(); j++) {
                Pillar a = pillars.get(i);
                Pillar b = pillars.get(j);
                addIfMatched(relations, PairRelationKind.CLASH, CombinationTables.SIX_CLASHES, a, b);
                addIfMatched(relations, PairRelationKind.COMBINE, CombinationTables.SIX_HARMONIES, a, b);
                addIfMatched(relations, PairRelationKind.HARM, CombinationTables.SIX_HARMS, a, b);
                addIfMatched(relations, PairRelationKind.PUNISH, CombinationTables.PUNISHMENTS, a, b);
                if (a.branch() == b.branch() && CombinationTables.SELF_PUNISHMENT.contains(a.branch())) {
                    relations.add(new PairRelation(PairRelationKind.SELF_PUNISH, a.role(), b.role(),
                            a.branch(), b.branch(), a.branch().getSymbol() + b.branch().getSymbol() + "自刑"));
                }
            }
        }
        return List.copyOf(relations);
    }

    private static void addIfMatched(List<PairRelation> out, PairRelationKind kind,
                                     List<CombinationTables.Pair> table, Pillar a, Pillar b) {
        CombinationTables.find(table, a.branch(), b.branch()).ifPresent(pair ->
                out.add(new PairRelation(kind, a.role(), b.role(), a.branch(), b.branch(), pair.name())));
    }
}
