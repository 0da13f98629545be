package com.work.chainexec.demo.config;

import com.work.chainexec.core.chain.ChainRpcClient;
import com.work.chainexec.demo.chain.web3j.Web3jChainRpcClient;
import okhttp3.OkHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

/**
 * Web3j 装配：
 * 当 chain.mode=web3j 时启用。
 */
@Configuration
@ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "web3j")
public class Web3jConfiguration {

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(ChainProperties properties) {
        OkHttpClient http = new OkHttpClient.Builder()
                .callTimeout(properties.getRequestTimeout())
                .build();
        return Web3j.build(new HttpService(properties.getRpcUrl(), http));
    }

    @Bean
    public ChainRpcClient web3jChainRpcClient(Web3j web3j, ChainProperties properties) {
        return new Web3jChainRpcClient(web3j, properties.getChainId());
    }
}
