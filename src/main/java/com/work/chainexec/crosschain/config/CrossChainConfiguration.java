package com.work.chainexec.crosschain.config;

import com.work.chainexec.core.chain.ChainRpcClient;
import com.work.chainexec.core.chain.TransactionSigner;
import com.work.chainexec.core.nonce.NonceAllocatorRegistry;
import com.work.chainexec.core.support.Sleeper;
import com.work.chainexec.crosschain.adapter.ChainAdapter;
import com.work.chainexec.crosschain.adapter.PipelineChainAdapter;
import com.work.chainexec.crosschain.bridge.BridgeManager;
import com.work.chainexec.crosschain.bridge.NoRouteBridgeManager;
import com.work.chainexec.crosschain.recovery.RecoveryHook;
import com.work.chainexec.crosschain.service.ChainHopOrchestrator;
import com.work.chainexec.demo.chain.web3j.CredentialsTransactionSigner;
import com.work.chainexec.demo.chain.web3j.Web3jChainRpcClient;
import com.work.chainexec.demo.config.ChainProperties;
import com.work.chainexec.txmgr.config.TxMgrProperties;
import com.work.chainexec.txmgr.service.SubmissionPipeline;
import com.work.chainexec.txmgr.service.TxRegistry;
import com.work.chainexec.txmgr.service.gas.GasSpikeGuard;
import com.work.chainexec.txmgr.support.metrics.TxMgrMetrics;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 跨链编排装配。
 *
 * 主链使用全局 {@link SubmissionPipeline}；chain.mode=web3j 时 crosschain.chains 中的其他链
 * 各自建一套 web3j 客户端 + pipeline，共用同一个签名私钥。
 */
@Configuration
@EnableConfigurationProperties(CrossChainProperties.class)
public class CrossChainConfiguration implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(CrossChainConfiguration.class);

    private final List<Web3j> remoteClients = new ArrayList<>();

    @Bean
    @ConditionalOnMissingBean(BridgeManager.class)
    public BridgeManager bridgeManager() {
        return new NoRouteBridgeManager();
    }

    @Bean
    @ConditionalOnMissingBean(RecoveryHook.class)
    public RecoveryHook recoveryHook() {
        return RecoveryHook.holdAll();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService crossChainPathExecutor(CrossChainProperties props) {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(props.getMaxConcurrentPaths(), r -> {
            Thread t = new Thread(r, "crosschain-path-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public ChainHopOrchestrator chainHopOrchestrator(BridgeManager bridgeManager,
                                                     RecoveryHook recoveryHook,
                                                     SubmissionPipeline pipeline,
                                                     ChainRpcClient chain,
                                                     NonceAllocatorRegistry allocators,
                                                     CrossChainProperties props,
                                                     ChainProperties chainProps,
                                                     TxMgrProperties txProps,
                                                     TxMgrMetrics metrics,
                                                     @Qualifier("crossChainPathExecutor") ExecutorService executor) {
        List<ChainAdapter> adapters = new ArrayList<>();
        adapters.add(new PipelineChainAdapter(pipeline, chain.getChainId()));
        if ("web3j".equalsIgnoreCase(chainProps.getMode())) {
            for (CrossChainProperties.ChainEntry entry : props.getChains()) {
                if (entry.getChainId() == chain.getChainId() || !StringUtils.hasText(entry.getRpcUrl())) {
                    continue;
                }
                adapters.add(remoteAdapter(entry, chainProps, txProps, allocators, metrics));
            }
        } else if (!props.getChains().isEmpty()) {
            log.warn("crosschain.chains ignored in chain.mode={}", chainProps.getMode());
        }
        return new ChainHopOrchestrator(
                bridgeManager,
                adapters,
                props,
                recoveryHook,
                metrics,
                executor,
                Sleeper.threadSleep(),
                Clock.systemUTC());
    }

    private ChainAdapter remoteAdapter(CrossChainProperties.ChainEntry entry,
                                       ChainProperties chainProps,
                                       TxMgrProperties txProps,
                                       NonceAllocatorRegistry allocators,
                                       TxMgrMetrics metrics) {
        OkHttpClient http = new OkHttpClient.Builder()
                .callTimeout(chainProps.getRequestTimeout())
                .build();
        Web3j web3j = Web3j.build(new HttpService(entry.getRpcUrl(), http));
        remoteClients.add(web3j);

        ChainRpcClient chain = new Web3jChainRpcClient(web3j, entry.getChainId());
        TransactionSigner signer = new CredentialsTransactionSigner(
                Credentials.create(chainProps.getPrivateKey()), entry.getChainId());
        Clock clock = Clock.systemUTC();
        SubmissionPipeline pipeline = new SubmissionPipeline(
                chain,
                signer,
                allocators.forAddress(chain, signer.getAddress()),
                new TxRegistry(txProps.getRegistryCapacity()),
                new GasSpikeGuard(chain, txProps, clock),
                txProps,
                metrics,
                Sleeper.threadSleep(),
                clock);
        log.info("chain adapter registered chainId={} rpcUrl={}", entry.getChainId(), entry.getRpcUrl());
        return new PipelineChainAdapter(pipeline, entry.getChainId());
    }

    @Override
    public void destroy() {
        for (Web3j web3j : remoteClients) {
            web3j.shutdown();
        }
        remoteClients.clear();
    }
}
