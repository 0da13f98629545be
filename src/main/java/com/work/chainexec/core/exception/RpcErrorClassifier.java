package com.work.chainexec.core.exception;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 错误分类：错误码 + 消息 -> {@link RpcErrorKind}。
 *
 * <p>只在 RPC 边界调用一次；已打标的 {@link ChainRpcException} 直接取其 kind。</p>
 */
public final class RpcErrorClassifier {

    /**
     * 节点/SDK 侧表示 nonce 过期的哨兵错误码。
     */
    public static final String NONCE_EXPIRED = "NONCE_EXPIRED";

    private static final List<String> NONCE_MARKERS = Collections.unmodifiableList(Arrays.asList(
            "nonce too low",
            "invalid nonce",
            "nonce has already been used",
            "replacement transaction underpriced"));

    private static final List<String> FATAL_MARKERS = Collections.unmodifiableList(Arrays.asList(
            "insufficient funds",
            "gas required exceeds allowance",
            "execution reverted",
            "invalid opcode"));

    private RpcErrorClassifier() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static RpcErrorKind classify(String code, String message) {
        if (NONCE_EXPIRED.equals(code)) {
            return RpcErrorKind.NONCE;
        }
        String m = message == null ? "" : message.toLowerCase(Locale.ROOT);
        for (String marker : NONCE_MARKERS) {
            if (m.contains(marker)) {
                return RpcErrorKind.NONCE;
            }
        }
        for (String marker : FATAL_MARKERS) {
            if (m.contains(marker)) {
                return RpcErrorKind.FATAL;
            }
        }
        return RpcErrorKind.TRANSIENT;
    }

    /**
     * 对任意异常取分类：边界异常直接用已有标签，其余（例如来自外部协作方的异常）按消息兜底分类。
     */
    public static RpcErrorKind classify(Throwable error) {
        if (error == null) {
            return RpcErrorKind.TRANSIENT;
        }
        if (error instanceof ChainRpcException) {
            return ((ChainRpcException) error).getKind();
        }
        if (error instanceof FatalSubmissionException) {
            return RpcErrorKind.FATAL;
        }
        if (error instanceof ChainExecException) {
            return ((ChainExecException) error).isRetryable() ? RpcErrorKind.TRANSIENT : RpcErrorKind.FATAL;
        }
        return classify(null, error.getMessage());
    }
}
