package com.work.chainexec.demo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 链连接配置（demo/宿主侧）。
 *
 * mode=mock: 使用 InMemoryChainRpcClient（进程内链，即发即打包）
 * mode=web3j: 使用 Web3jChainRpcClient
 */
@ConfigurationProperties(prefix = "chain")
public class ChainProperties {

    /**
     * mock 或 web3j
     */
    private String mode = "mock";

    /**
     * Web3j HTTP RPC 地址，例如 http://localhost:8545
     */
    private String rpcUrl = "http://localhost:8545";

    /**
     * 链 id；web3j 模式下为 0 时启动后通过 eth_chainId 查询。
     */
    private long chainId = 31337;

    /**
     * 签名私钥（十六进制）。默认是本地开发链的公开测试账户，禁止用于真实网络。
     */
    private String privateKey = "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcb78d7ebf4f2ff80";

    private Duration requestTimeout = Duration.ofSeconds(10);

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public long getChainId() {
        return chainId;
    }

    public void setChainId(long chainId) {
        this.chainId = chainId;
    }

    public String getPrivateKey() {
        return privateKey;
    }

    public void setPrivateKey(String privateKey) {
        this.privateKey = privateKey;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }
}
