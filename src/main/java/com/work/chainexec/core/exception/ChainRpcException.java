package com.work.chainexec.core.exception;

/**
 * 链 RPC 边界抛出的异常，携带已分类的 {@link RpcErrorKind}。
 */
public class ChainRpcException extends ChainExecException {

    private final RpcErrorKind kind;
    private final String code;

    public ChainRpcException(RpcErrorKind kind, String code, String message) {
        this(kind, code, message, null);
    }

    public ChainRpcException(RpcErrorKind kind, String code, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind == null ? RpcErrorKind.TRANSIENT : kind;
        this.code = code;
    }

    /**
     * 按错误码与消息分类后构造，供各 RPC 实现在边界处使用。
     */
    public static ChainRpcException classified(String code, String message, Throwable cause) {
        return new ChainRpcException(RpcErrorClassifier.classify(code, message), code, message, cause);
    }

    public static ChainRpcException classified(String message) {
        return classified(null, message, null);
    }

    public RpcErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    @Override
    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
