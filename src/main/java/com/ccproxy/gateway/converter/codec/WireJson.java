package com.ccproxy.gateway.converter.codec;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.ccproxy.gateway.exception.UnmarshalException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * 线上 JSON 读写辅助
 */
final class WireJson {

    private WireJson() {
    }

    /**
     * 解析顶层 JSON 对象并在其上执行读取逻辑，任何解析 / 类型错误统一转为 {@link UnmarshalException}
     * <p>
     * 字面量 null 视为空对象
     */
    static <T> T read(byte[] data, String provider, String direction, Function<JSONObject, T> reader) {
        try {
            JSONObject root = data == null || data.length == 0
                    ? null
                    : JSON.parseObject(new String(data, StandardCharsets.UTF_8));
            return reader.apply(root != null ? root : new JSONObject());
        } catch (JSONException | ClassCastException | NumberFormatException e) {
            throw new UnmarshalException(provider, direction, e);
        }
    }

    static byte[] toBytes(JSONObject json) {
        return json.toJSONString().getBytes(StandardCharsets.UTF_8);
    }

    static String stringOrEmpty(String value) {
        return value != null ? value : "";
    }

    /**
     * 读取字符串或字符串数组（如 OpenAI 的 stop）
     */
    static List<String> stringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof String s) {
            result.add(s);
        } else if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof String s) {
                    result.add(s);
                } else if (item != null) {
                    throw new JSONException("expected string element, got " + item.getClass().getSimpleName());
                }
            }
        } else if (value != null) {
            throw new JSONException("expected string or string array, got " + value.getClass().getSimpleName());
        }
        return result;
    }

    static JSONArray objects(JSONObject json, String key) {
        JSONArray arr = json.getJSONArray(key);
        return arr != null ? arr : new JSONArray();
    }
}
