package com.ccproxy.gateway.tool;

import com.alibaba.fastjson2.JSONObject;
import com.ccproxy.gateway.converter.model.Tool;

import java.util.ArrayList;
import java.util.List;

/**
 * 目标协议不支持工具声明时的降级：把工具列表渲染成说明文本，放进 system 提示
 */
public final class ToolFallback {

    public static final String HEADER = "Available tools (for reference only, cannot be called directly):";

    private ToolFallback() {
    }

    /**
     * 渲染工具说明，格式为
     * <pre>
     * Available tools (for reference only, cannot be called directly):
     * - name: description (parameters: a, b)
     * </pre>
     * 没有工具时返回空串
     */
    public static String describeTools(List<Tool> tools) {
        if (tools == null || tools.isEmpty()) {
            return "";
        }
        List<String> lines = new ArrayList<>(tools.size() + 1);
        lines.add(HEADER);
        for (Tool tool : tools) {
            lines.add(describe(tool));
        }
        return String.join("\n", lines);
    }

    /**
     * 将工具说明追加到已有的 system 文本之后（空行分隔）
     */
    public static String appendToSystem(String system, List<Tool> tools) {
        String descriptions = describeTools(tools);
        if (descriptions.isEmpty()) return system != null ? system : "";
        if (system == null || system.isEmpty()) return descriptions;
        return system + "\n\n" + descriptions;
    }

    private static String describe(Tool tool) {
        StringBuilder sb = new StringBuilder("- ").append(tool.name());
        if (tool.description() != null && !tool.description().isEmpty()) {
            sb.append(": ").append(tool.description());
        }
        JSONObject schema = tool.inputSchema();
        if (schema != null && schema.get("properties") instanceof JSONObject properties && !properties.isEmpty()) {
            sb.append(" (parameters: ").append(String.join(", ", properties.keySet())).append(")");
        }
        return sb.toString();
    }
}
