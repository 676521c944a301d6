package com.ccproxy.gateway.converter.model;

import com.alibaba.fastjson2.JSONObject;

/**
 * 模型产出的一次工具调用（OpenAI 结构）
 *
 * @param id       关联 ID，与 tool_use 块的 id 一一对应
 * @param type     固定为 function
 * @param function 函数名与 JSON 编码的参数
 */
public record ToolCall(String id, String type, FunctionCall function) {

    public static final String TYPE_FUNCTION = "function";

    public static ToolCall function(String id, String name, String arguments) {
        return new ToolCall(id, TYPE_FUNCTION, new FunctionCall(name, arguments));
    }

    public static ToolCall fromJson(JSONObject json) {
        JSONObject fn = json.getJSONObject("function");
        FunctionCall function = fn == null
                ? new FunctionCall(null, "")
                : new FunctionCall(fn.getString("name"), fn.getString("arguments"));
        return new ToolCall(json.getString("id"), json.getString("type"), function);
    }

    public JSONObject toJson() {
        return JSONObject.of(
                "id", id, //
                "type", type, //
                "function", JSONObject.of( //
                        "name", function.name(), //
                        "arguments", function.arguments() //
                ) //
        );
    }

    public String name() {
        return function != null ? function.name() : null;
    }

    public String arguments() {
        return function != null && function.arguments() != null ? function.arguments() : "";
    }

    public record FunctionCall(String name, String arguments) {}
}
