package com.work.chainexec.demo.chain.web3j;

import com.work.chainexec.core.chain.TransactionSigner;
import com.work.chainexec.core.chain.TxRequest;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

import static com.work.chainexec.core.support.ValidationUtils.requireNonNull;

/**
 * 本地私钥签名：legacy 交易按 EIP-155 签名，带 EIP-1559 费用字段时签 type-2 交易。
 */
public class CredentialsTransactionSigner implements TransactionSigner {

    /**
     * 调用方未给 gasLimit 时的缺省值。
     */
    static final BigInteger DEFAULT_GAS_LIMIT = BigInteger.valueOf(300_000);

    private final Credentials credentials;
    private final long chainId;

    public CredentialsTransactionSigner(Credentials credentials, long chainId) {
        this.credentials = requireNonNull(credentials, "credentials");
        this.chainId = chainId;
    }

    @Override
    public String getAddress() {
        return credentials.getAddress();
    }

    @Override
    public String sign(TxRequest request, long nonce) {
        requireNonNull(request, "request");
        BigInteger gasLimit = request.getGasLimit() == null ? DEFAULT_GAS_LIMIT : request.getGasLimit();
        RawTransaction raw;
        if (request.isEip1559()) {
            raw = RawTransaction.createTransaction(chainId, BigInteger.valueOf(nonce), gasLimit,
                    request.getTo(), request.getValue(), request.getData(),
                    request.getMaxPriorityFeePerGas(), request.getMaxFeePerGas());
        } else {
            requireNonNull(request.getGasPrice(), "gasPrice");
            raw = RawTransaction.createTransaction(BigInteger.valueOf(nonce), request.getGasPrice(), gasLimit,
                    request.getTo(), request.getValue(), request.getData());
        }
        byte[] signed = TransactionEncoder.signMessage(raw, chainId, credentials);
        return Numeric.toHexString(signed);
    }
}
