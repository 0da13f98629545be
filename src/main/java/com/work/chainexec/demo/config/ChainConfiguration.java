package com.work.chainexec.demo.config;

import com.work.chainexec.core.chain.ChainRpcClient;
import com.work.chainexec.core.chain.TransactionSigner;
import com.work.chainexec.demo.chain.memory.InMemoryChainRpcClient;
import com.work.chainexec.demo.chain.web3j.CredentialsTransactionSigner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.crypto.Credentials;

import java.math.BigInteger;

/**
 * 宿主侧链装配：链 RPC 端口 + 签名端口。
 *
 * 默认 mock（进程内链）；chain.mode=web3j 时由 {@link Web3jConfiguration} 提供 RPC 实现。
 */
@Configuration
@EnableConfigurationProperties(ChainProperties.class)
public class ChainConfiguration {

    private static final BigInteger MOCK_GAS_PRICE = BigInteger.valueOf(20_000_000_000L);

    @Bean
    @ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "mock", matchIfMissing = true)
    public ChainRpcClient inMemoryChainRpcClient(ChainProperties properties) {
        return new InMemoryChainRpcClient(properties.getChainId(), MOCK_GAS_PRICE);
    }

    @Bean
    @ConditionalOnMissingBean(TransactionSigner.class)
    public TransactionSigner transactionSigner(ChainProperties properties, ChainRpcClient chainRpcClient) {
        return new CredentialsTransactionSigner(Credentials.create(properties.getPrivateKey()),
                chainRpcClient.getChainId());
    }
}
