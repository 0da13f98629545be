package com.work.chainexec.relay.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.work.chainexec.core.exception.RelayException;
import com.work.chainexec.relay.RelayConfig;

import java.util.List;

/**
 * relay JSON-RPC 传输端口。
 */
public interface RelayTransport {

    /**
     * 调用 relay 的 JSON-RPC 方法，返回 result 节点（可能是 NullNode）。
     *
     * @throws RelayException HTTP 失败、JSON-RPC error 或响应无法解析
     */
    JsonNode call(RelayConfig relay, String method, List<?> params);
}
