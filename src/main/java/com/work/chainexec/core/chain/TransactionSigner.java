package com.work.chainexec.core.chain;

/**
 * 签名端口：用显式 nonce 把请求签成 raw transaction（0x 开头的十六进制）。
 */
public interface TransactionSigner {

    String getAddress();

    String sign(TxRequest request, long nonce);
}
