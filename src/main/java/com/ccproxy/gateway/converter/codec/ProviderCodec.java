package com.ccproxy.gateway.converter.codec;

import com.ccproxy.gateway.converter.ConverterFeatures;
import com.ccproxy.gateway.converter.model.MessageFormat;
import com.ccproxy.gateway.converter.model.Request;
import com.ccproxy.gateway.converter.model.Response;
import com.ccproxy.gateway.converter.model.StreamEvent;

/**
 * 提供方编解码器
 * <p>
 * 在某个提供方的线上 JSON 与通用中间格式之间双向转换，请求和响应都要支持。
 * 实现必须是无状态的纯函数，可被任意多个线程并发调用。
 */
public interface ProviderCodec {

    MessageFormat format();

    /**
     * 用于错误消息与日志的提供方名称，例如 "OpenAI"
     */
    String providerName();

    ConverterFeatures features();

    Request decodeRequest(byte[] data);

    Response decodeResponse(byte[] data);

    byte[] encodeRequest(Request request);

    byte[] encodeResponse(Response response);

    /**
     * 提供方格式 → 通用格式
     */
    default byte[] toGeneric(byte[] data, boolean isRequest) {
        return isRequest
                ? GenericJson.writeRequest(decodeRequest(data))
                : GenericJson.writeResponse(decodeResponse(data));
    }

    /**
     * 通用格式 → 提供方格式
     */
    default byte[] fromGeneric(byte[] data, boolean isRequest) {
        return isRequest
                ? encodeRequest(GenericJson.readRequest(data))
                : encodeResponse(GenericJson.readResponse(data));
    }

    /**
     * 流式事件转换钩子，目前对所有提供方都是原样透传
     */
    default StreamEvent transformStreamEvent(StreamEvent event) {
        return event;
    }
}
