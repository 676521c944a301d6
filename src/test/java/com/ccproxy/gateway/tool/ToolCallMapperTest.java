package com.ccproxy.gateway.tool;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.ccproxy.gateway.converter.model.ContentBlock;
import com.ccproxy.gateway.converter.model.ToolCall;
import com.ccproxy.gateway.exception.ToolCallValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ToolCallMapperTest {

    @Test
    void shouldKeepIdInBothDirections() {
        ToolCall call = ToolCall.function("call_42", "search", "{\"q\":\"java\"}");

        ContentBlock block = ToolCallMapper.toToolUse(call, 0);
        assertEquals("call_42", block.id());
        assertEquals("java", block.input().getString("q"));

        ToolCall back = ToolCallMapper.fromToolUse(block);
        assertEquals("call_42", back.id());
        assertEquals(ToolCall.TYPE_FUNCTION, back.type());
        assertEquals(JSONObject.of("q", "java"), JSON.parseObject(back.arguments()));
    }

    @Test
    void shouldTreatEmptyArgumentsAsEmptyObject() {
        ContentBlock block = ToolCallMapper.toToolUse(ToolCall.function("call_1", "ping", ""), 0);
        assertTrue(block.input().isEmpty());
    }

    @Test
    void shouldAcceptMissingType() {
        ToolCall call = new ToolCall("call_1", null, new ToolCall.FunctionCall("ping", "{}"));
        assertEquals(1, ToolCallMapper.toToolUseBlocks(List.of(call)).size());
    }

    @Test
    void shouldRejectInvalidStructure() {
        assertThrows(ToolCallValidationException.class,
                () -> ToolCallMapper.toToolUse(ToolCall.function("", "ping", "{}"), 0));
        assertThrows(ToolCallValidationException.class,
                () -> ToolCallMapper.toToolUse(new ToolCall("call_1", "retrieval", new ToolCall.FunctionCall("ping", "{}")), 0));
        assertThrows(ToolCallValidationException.class,
                () -> ToolCallMapper.toToolUse(ToolCall.function("call_1", "", "{}"), 0));
    }

    @Test
    void shouldReportMalformedArguments() {
        ToolCallValidationException e = assertThrows(ToolCallValidationException.class,
                () -> ToolCallMapper.toToolUse(ToolCall.function("call_1", "search", "{q:"), 2));

        assertEquals(ToolCallValidationException.JSON_ERROR, e.getType());
        assertEquals("search", e.getToolName());
        assertTrue(e.getDetail().startsWith("tool call 2"));
    }
}
