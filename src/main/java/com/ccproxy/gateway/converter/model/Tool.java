package com.ccproxy.gateway.converter.model;

import com.alibaba.fastjson2.JSONObject;

/**
 * 工具定义
 *
 * @param name        工具名（非空）
 * @param description 描述，可选
 * @param inputSchema JSON-Schema 风格的入参定义，顶层 type 必须是 object
 */
public record Tool(String name, String description, JSONObject inputSchema) {

    /**
     * Anthropic / 通用格式：{name, description, input_schema}
     */
    public static Tool fromJson(JSONObject json) {
        Object schema = json.get("input_schema");
        return new Tool(json.getString("name"), json.getString("description"),
                schema instanceof JSONObject jo ? jo : null);
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("name", name);
        if (description != null && !description.isEmpty()) {
            json.put("description", description);
        }
        json.put("input_schema", inputSchema);
        return json;
    }
}
