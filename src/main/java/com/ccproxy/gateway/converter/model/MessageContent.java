package com.ccproxy.gateway.converter.model;

import com.alibaba.fastjson2.JSONArray;

import java.util.List;

/**
 * 消息内容（三选一的标签联合）
 * <p>
 * 解码时一次性确定具体形态，之后各编解码器只需按变体分支处理：
 * <ul>
 *     <li>{@link Text} 纯字符串</li>
 *     <li>{@link Blocks} 类型化内容块序列</li>
 *     <li>{@link Opaque} 无法识别的任意 JSON 值，输出到纯文本目标时会做有损字符串化</li>
 * </ul>
 */
public sealed interface MessageContent permits MessageContent.Text, MessageContent.Blocks, MessageContent.Opaque {

    MessageContent EMPTY = new Text("");

    static MessageContent text(String text) {
        return new Text(text);
    }

    static MessageContent blocks(List<ContentBlock> blocks) {
        return new Blocks(blocks);
    }

    /**
     * 转回 JSON 值（String / JSONArray / 原始对象）
     */
    Object toRaw();

    record Text(String value) implements MessageContent {
        public Text {
            value = value != null ? value : "";
        }

        @Override
        public Object toRaw() {
            return value;
        }
    }

    record Blocks(List<ContentBlock> blocks) implements MessageContent {
        public Blocks {
            blocks = blocks != null ? List.copyOf(blocks) : List.of();
        }

        @Override
        public Object toRaw() {
            JSONArray arr = new JSONArray();
            for (ContentBlock block : blocks) {
                arr.add(block.toJson());
            }
            return arr;
        }

        public boolean hasToolBlocks() {
            return blocks.stream().anyMatch(b -> b.isToolUse() || b.isToolResult());
        }
    }

    record Opaque(Object value) implements MessageContent {
        @Override
        public Object toRaw() {
            return value;
        }
    }
}
