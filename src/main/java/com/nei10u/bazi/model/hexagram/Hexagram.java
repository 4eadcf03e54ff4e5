package com.nei10u.bazi.model.hexagram;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * 一次起卦结果：本卦，及有动爻时的变卦。
 */
@Value
@Builder
public class Hexagram {

    List<Line> lines;
    int code;
    Trigram upper;
    Trigram lower;
    HexagramInfo primary;
    List<Integer> movingLines;
    HexagramInfo future;

    public boolean hasChange() {
        return !movingLines.isEmpty();
    }

    public Optional<HexagramInfo> future() {
        return Optional.ofNullable(future);
    }

    public String display() {
        StringBuilder sb = new StringBuilder();
        sb.append("【本卦】").append(primary.name()).append('\n');
        sb.append("   卦义：").append(primary.meaning()).append('\n');
        sb.append("   上卦：").append(upper.display()).append('\n');
        sb.append("   下卦：").append(lower.display()).append('\n');
        if (hasChange()) {
            sb.append("【动爻】第 ").append(movingLines.stream().map(String::valueOf).reduce((a, b) -> a + ", " + b).orElse(""))
                    .append(" 爻\n");
            sb.append("【变卦】").append(future.name()).append('\n');
            sb.append("   卦义：").append(future.meaning()).append('\n');
        } else {
            sb.append("【动爻】无动爻（六爻皆静）\n");
        }
        for (Line line : lines) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }
}
