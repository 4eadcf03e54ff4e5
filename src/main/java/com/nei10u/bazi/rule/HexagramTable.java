package com.nei10u.bazi.rule;

import com.alibaba.fastjson2.JSON;
import com.nei10u.bazi.model.hexagram.HexagramInfo;
import com.nei10u.bazi.model.hexagram.Trigram;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 六十四卦表。构造时从 classpath 读入并校验，表不完整则容器启动失败。
 */
@Component
public class HexagramTable {

    private static final Logger log = LoggerFactory.getLogger(HexagramTable.class);

    public static final String RESOURCE = "rules/hexagrams.json";

    private final HexagramInfo[] byCode;

    /**
     * fastjson2 反序列化用
     */
    @Data
    public static class HexagramRow {
        private int number;
        private String name;
        private String shortName;
        private String upper;
        private String lower;
        private String meaning;
    }

    public HexagramTable() {
        this(RESOURCE);
    }

    @Autowired
    public HexagramTable(@Value("${bazi.engine.hexagram-table:" + RESOURCE + "}") String resource) {
        this.byCode = load(resource);
    }

    /**
     * @param code 6 位卦码，bit0 为初爻
     */
    public HexagramInfo byCode(int code) {
        if (code < 0 || code >= byCode.length) {
            throw new IllegalArgumentException("卦码越界: " + code);
        }
        return byCode[code];
    }

    public List<HexagramInfo> all() {
        return List.of(byCode);
    }

    static HexagramInfo[] load(String resource) {
        String json;
        try (InputStream in = new ClassPathResource(resource).getInputStream()) {
            json = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("无法读取卦表 " + resource, e);
        }

        List<HexagramRow> rows = JSON.parseArray(json, HexagramRow.class);
        if (rows == null || rows.size() != 64) {
            throw new IllegalStateException("卦表必须恰好 64 卦: " + resource
                    + " (实际 " + (rows == null ? 0 : rows.size()) + ")");
        }
        HexagramInfo[] table = new HexagramInfo[64];
        for (HexagramRow row : rows) {
            HexagramInfo info;
            try {
                info = new HexagramInfo(row.getNumber(), row.getName(), row.getShortName(),
                        Trigram.fromName(row.getUpper()), Trigram.fromName(row.getLower()), row.getMeaning());
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("卦表第 " + row.getNumber() + " 卦上下卦非法: " + resource, e);
            }
            if (table[info.code()] != null) {
                throw new IllegalStateException("卦码重复: " + info.name() + " 与 " + table[info.code()].name());
            }
            table[info.code()] = info;
        }
        log.debug("loaded {} hexagrams from {}", rows.size(), resource);
        return table;
    }
}
