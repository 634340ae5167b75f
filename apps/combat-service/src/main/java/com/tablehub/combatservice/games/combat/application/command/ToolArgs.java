package com.tablehub.combatservice.games.combat.application.command;

import com.tablehub.combatservice.games.combat.domain.error.CombatErrorCode;
import com.tablehub.combatservice.games.combat.domain.error.CombatException;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 工具调用参数（snake_case 的无类型 Map）的读取器。
 * 只在解析阶段使用；任何缺失或类型不符都转换为 INVALID_COMMAND。
 */
final class ToolArgs {

    private final String tool;
    private final Map<String, Object> raw;

    ToolArgs(String tool, Map<String, Object> raw) {
        this.tool = tool;
        this.raw = raw == null ? Map.of() : raw;
    }

    /** 拒绝未声明的参数名 */
    ToolArgs allow(String... keys) {
        Set<String> allowed = Set.of(keys);
        for (String k : raw.keySet()) {
            if (!allowed.contains(k)) {
                throw invalid("unknown argument '" + k + "'");
            }
        }
        return this;
    }

    boolean has(String key) {
        return raw.get(key) != null;
    }

    Object raw(String key) {
        return raw.get(key);
    }

    String requireString(String key) {
        String v = optString(key);
        if (StringUtils.isBlank(v)) {
            throw invalid("missing required argument '" + key + "'");
        }
        return v;
    }

    String optString(String key) {
        Object v = raw.get(key);
        if (v == null) {
            return null;
        }
        if (v instanceof String s) {
            return s;
        }
        if (v instanceof Number || v instanceof Boolean) {
            return String.valueOf(v);
        }
        throw invalid("argument '" + key + "' must be a string");
    }

    int requireInt(String key) {
        Integer v = optInt(key);
        if (v == null) {
            throw invalid("missing required argument '" + key + "'");
        }
        return v;
    }

    Integer optInt(String key) {
        return toInt(key, raw.get(key));
    }

    int optInt(String key, int def) {
        Integer v = optInt(key);
        return v == null ? def : v;
    }

    boolean optBool(String key, boolean def) {
        Object v = raw.get(key);
        if (v == null) {
            return def;
        }
        if (v instanceof Boolean b) {
            return b;
        }
        if (v instanceof String s) {
            String t = s.trim().toLowerCase();
            if (t.equals("true") || t.equals("on") || t.equals("yes")) {
                return true;
            }
            if (t.equals("false") || t.equals("off") || t.equals("no")) {
                return false;
            }
        }
        throw invalid("argument '" + key + "' must be a boolean");
    }

    List<String> stringList(String key) {
        Object v = raw.get(key);
        if (v == null) {
            throw invalid("missing required argument '" + key + "'");
        }
        if (!(v instanceof List<?> list)) {
            throw invalid("argument '" + key + "' must be an array");
        }
        List<String> out = new ArrayList<>();
        for (Object o : list) {
            if (!(o instanceof String s)) {
                throw invalid("argument '" + key + "' must contain strings");
            }
            out.add(s);
        }
        return out;
    }

    /** 对象数组参数，逐个包装成 ToolArgs */
    List<ToolArgs> objectList(String key) {
        Object v = raw.get(key);
        if (v == null) {
            return List.of();
        }
        if (!(v instanceof List<?> list)) {
            throw invalid("argument '" + key + "' must be an array");
        }
        List<ToolArgs> out = new ArrayList<>();
        for (Object o : list) {
            out.add(new ToolArgs(tool, asObject(key, o)));
        }
        return out;
    }

    /** 对象参数（如 pc_initiatives: {characterId: initiative}） */
    Map<String, Object> object(String key) {
        Object v = raw.get(key);
        return v == null ? Map.of() : asObject(key, v);
    }

    Integer toInt(String key, Object v) {
        if (v == null) {
            return null;
        }
        if (v instanceof Number n) {
            double d = n.doubleValue();
            if (d != Math.rint(d)) {
                throw invalid("argument '" + key + "' must be an integer");
            }
            return n.intValue();
        }
        if (v instanceof String s && NumberUtils.isCreatable(s.trim())) {
            return toInt(key, NumberUtils.createNumber(s.trim()));
        }
        throw invalid("argument '" + key + "' must be an integer");
    }

    CombatException invalid(String message) {
        return new CombatException(CombatErrorCode.INVALID_COMMAND, tool + ": " + message);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asObject(String key, Object o) {
        if (!(o instanceof Map<?, ?> m)) {
            throw invalid("argument '" + key + "' must contain objects");
        }
        for (Object k : m.keySet()) {
            if (!(k instanceof String)) {
                throw invalid("argument '" + key + "' has a non-string key");
            }
        }
        return (Map<String, Object>) m;
    }
}
