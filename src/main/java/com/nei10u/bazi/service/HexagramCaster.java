package com.nei10u.bazi.service;

import com.nei10u.bazi.model.hexagram.Hexagram;
import com.nei10u.bazi.model.hexagram.HexagramInfo;
import com.nei10u.bazi.model.hexagram.Line;
import com.nei10u.bazi.model.hexagram.LineType;
import com.nei10u.bazi.model.hexagram.Trigram;
import com.nei10u.bazi.rule.HexagramTable;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 金钱课起卦：三枚硬币摇六次，自初爻至上爻。
 * 6=2+2+2 老阴(动)，7=2+2+3 少阳，8=2+3+3 少阴，9=3+3+3 老阳(动)。
 */
@Service
@RequiredArgsConstructor
public class HexagramCaster {

    private static final Logger log = LoggerFactory.getLogger(HexagramCaster.class);

    public static final int HEADS = 3;
    public static final int TAILS = 2;
    private static final int LINES = 6;
    private static final int COINS = 3;

    private final HexagramTable table;

    public Hexagram cast() {
        return cast(CoinFlipper.threadLocal());
    }

    public Hexagram cast(CoinFlipper coins) {
        int[] values = new int[LINES];
        for (int i = 0; i < LINES; i++) {
            values[i] = tossLine(coins);
        }
        return fromValues(values);
    }

    /**
     * 三枚硬币之和，必在 6..9
     */
    public int tossLine(CoinFlipper coins) {
        int sum = 0;
        for (int c = 0; c < COINS; c++) {
            sum += coins.heads() ? HEADS : TAILS;
        }
        return sum;
    }

    /**
     * 按给定爻值（自下而上）成卦，用于手工摇卦录入。
     */
    public Hexagram fromValues(int... values) {
        if (values == null || values.length != LINES) {
            throw new IllegalArgumentException("需要 6 个爻值");
        }
        List<Line> lines = new ArrayList<>(LINES);
        List<Integer> moving = new ArrayList<>();
        int code = 0;
        int movingMask = 0;
        for (int i = 0; i < LINES; i++) {
            LineType type = LineType.fromValue(values[i]);
            lines.add(new Line(i + 1, type));
            if (type.isYang()) {
                code |= 1 << i;
            }
            if (type.isMoving()) {
                movingMask |= 1 << i;
                moving.add(i + 1);
            }
        }

        HexagramInfo primary = table.byCode(code);
        HexagramInfo future = movingMask == 0 ? null : table.byCode(transform(code, movingMask));
        log.debug("cast {} -> {}{}", values, primary.name(), future == null ? "" : " => " + future.name());

        return Hexagram.builder()
                .lines(List.copyOf(lines))
                .code(code)
                .upper(Trigram.fromCode(code >> 3))
                .lower(Trigram.fromCode(code))
                .primary(primary)
                .movingLines(List.copyOf(moving))
                .future(future)
                .build();
    }

    /**
     * 动爻阴阳互变，其余不动
     */
    public int transform(int code, int movingMask) {
        return (code ^ movingMask) & 0b111111;
    }

    public HexagramInfo lookup(int code) {
        return table.byCode(code);
    }
}
