package com.ccproxy.gateway.converter.codec;

/**
 * 各协议结束原因与通用 stop_reason（Anthropic 取值）之间的映射
 */
final class StopReasons {

    static final String END_TURN = "end_turn";
    static final String MAX_TOKENS = "max_tokens";
    static final String TOOL_USE = "tool_use";
    static final String STOP_SEQUENCE = "stop_sequence";

    private StopReasons() {
    }

    static String fromOpenAi(String finishReason) {
        if (finishReason == null || finishReason.isEmpty()) return null;
        return switch (finishReason) {
            case "length" -> MAX_TOKENS;
            case "tool_calls", "function_call" -> TOOL_USE;
            case "content_filter" -> STOP_SEQUENCE;
            default -> END_TURN;
        };
    }

    static String toOpenAi(String stopReason) {
        if (stopReason == null) return "stop";
        return switch (stopReason) {
            case MAX_TOKENS -> "length";
            case TOOL_USE -> "tool_calls";
            default -> "stop";
        };
    }

    static String fromGoogle(String finishReason) {
        if (finishReason == null || finishReason.isEmpty()) return null;
        return switch (finishReason) {
            case "MAX_TOKENS" -> MAX_TOKENS;
            case "SAFETY", "RECITATION", "BLOCKLIST", "PROHIBITED_CONTENT", "SPII" -> STOP_SEQUENCE;
            default -> END_TURN;
        };
    }

    static String toGoogle(String stopReason) {
        return MAX_TOKENS.equals(stopReason) ? "MAX_TOKENS" : "STOP";
    }
}
