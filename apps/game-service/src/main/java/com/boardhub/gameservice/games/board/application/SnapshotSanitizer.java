package com.boardhub.gameservice.games.board.application;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * 存档清洗工具：把反序列化出来的“弱类型”数据还原为强类型，并丢弃脏数据。
 * - 未知参与者引用：剔除；
 * - 重复 id：去重（保留首次出现）；
 * - 非数字值：能转就转（"12" → 12），不能转就丢弃；
 * 每一次修正都追加到 warnings，由调用方决定是否提示房主。
 */
public final class SnapshotSanitizer {

    private SnapshotSanitizer() {
    }

    /** id 列表：去重、去空、剔除未知参与者 */
    public static List<String> idList(Object raw, Set<String> known, String field, List<String> warnings) {
        List<String> out = new ArrayList<>();
        if (raw == null) return out;
        if (!(raw instanceof Collection<?> items)) {
            warnings.add(field + ": expected a list, discarded");
            return out;
        }
        Set<String> seen = new LinkedHashSet<>();
        for (Object item : items) {
            String id = item == null ? null : String.valueOf(item).trim();
            if (id == null || id.isEmpty()) {
                warnings.add(field + ": blank id removed");
            } else if (!known.contains(id)) {
                warnings.add(field + ": unknown participant " + id + " removed");
            } else if (!seen.add(id)) {
                warnings.add(field + ": duplicate " + id + " removed");
            }
        }
        out.addAll(seen);
        return out;
    }

    /** 参与者 → 整数：值非数字则丢弃 */
    public static Map<String, Integer> intMap(Object raw, Set<String> known, String field, List<String> warnings) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : entries(raw, known, field, warnings).entrySet()) {
            OptionalInt v = toInt(e.getValue());
            if (v.isPresent()) {
                out.put(e.getKey(), v.getAsInt());
            } else {
                warnings.add(field + ": non-numeric value for " + e.getKey() + " discarded");
            }
        }
        return out;
    }

    /** 参与者 → 字符串：空值丢弃 */
    public static Map<String, String> stringMap(Object raw, Set<String> known, String field, List<String> warnings) {
        Map<String, String> out = new LinkedHashMap<>();
        entries(raw, known, field, warnings).forEach((k, v) -> {
            if (v != null) out.put(k, String.valueOf(v));
        });
        return out;
    }

    public static OptionalInt toInt(Object value) {
        if (value instanceof Integer i) return OptionalInt.of(i);
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d == Math.rint(d) && Math.abs(d) <= Integer.MAX_VALUE) return OptionalInt.of((int) d);
            return OptionalInt.empty();
        }
        if (value instanceof String s) {
            String t = s.trim();
            try {
                return OptionalInt.of(Integer.parseInt(t));
            } catch (NumberFormatException e) {
                try {
                    return toInt(Double.parseDouble(t));
                } catch (NumberFormatException again) {
                    return OptionalInt.empty();
                }
            }
        }
        return OptionalInt.empty();
    }

    public static boolean bool(Object value) {
        if (value instanceof Boolean b) return b;
        if (value instanceof String s) return Boolean.parseBoolean(s.trim());
        return false;
    }

    private static Map<String, Object> entries(Object raw, Set<String> known, String field, List<String> warnings) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (raw == null) return out;
        if (!(raw instanceof Map<?, ?> map)) {
            warnings.add(field + ": expected a map, discarded");
            return out;
        }
        for (Map.Entry<?, ?> e : map.entrySet()) {
            String key = e.getKey() == null ? "" : String.valueOf(e.getKey()).trim();
            if (!known.contains(key)) {
                warnings.add(field + ": unknown participant " + key + " removed");
                continue;
            }
            out.put(key, e.getValue());
        }
        return out;
    }
}
