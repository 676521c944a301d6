package com.ccproxy.gateway.converter;

import com.alibaba.fastjson2.JSONObject;
import com.ccproxy.gateway.converter.model.ContentBlock;
import com.ccproxy.gateway.converter.model.Message;
import com.ccproxy.gateway.converter.model.MessageContent;
import com.ccproxy.gateway.converter.model.Request;
import com.ccproxy.gateway.converter.model.Tool;
import com.ccproxy.gateway.exception.ConversionException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RequestValidatorTest {

    private final RequestValidator validator = new RequestValidator(ConverterOptions.defaults());

    @Test
    void shouldAcceptWellFormedRequest() {
        Request request = Request.builder()
                .model("claude-3")
                .messages(List.of(Message.user("Hi"), Message.assistant("Hello")))
                .tools(List.of(new Tool("noop", null, JSONObject.of("type", "object"))))
                .build();

        assertDoesNotThrow(() -> validator.validate(request));
    }

    @Test
    void shouldRequireModelAndMessages() {
        assertEquals("model cannot be empty", message(Request.builder().messages(List.of(Message.user("Hi"))).build()));
        assertEquals("messages array cannot be empty", message(Request.builder().model("m").build()));
    }

    @Test
    void shouldLimitMessageCount() {
        List<Message> messages = new ArrayList<>();
        for (int i = 0; i < 101; i++) {
            messages.add(Message.user("m" + i));
        }
        assertEquals("too many messages: 101 (max 100)",
                message(Request.builder().model("m").messages(messages).build()));
    }

    @Test
    void shouldCheckBlockStructure() {
        Request request = Request.builder()
                .model("m")
                .messages(List.of(new Message("assistant", MessageContent.blocks(List.of(
                        ContentBlock.toolUse("", "search", null))))))
                .build();

        assertEquals("message 0: content block 0: tool_use ID cannot be empty", message(request));
    }

    @Test
    void shouldRejectEmptyText() {
        Request request = Request.builder()
                .model("m")
                .messages(List.of(new Message("user", MessageContent.blocks(List.of(ContentBlock.text(""))))))
                .build();

        assertEquals("message 0: content block 0: text content cannot be empty", message(request));
    }

    @Test
    void shouldLimitToolCount() {
        List<Tool> tools = new ArrayList<>();
        for (int i = 0; i < 51; i++) {
            tools.add(new Tool("t" + i, null, JSONObject.of("type", "object")));
        }
        Request request = Request.builder().model("m").messages(List.of(Message.user("Hi"))).tools(tools).build();

        assertEquals("too many tools: 51 (max 50)", message(request));
    }

    private String message(Request request) {
        return assertThrows(ConversionException.class, () -> validator.validate(request)).getMessage();
    }
}
