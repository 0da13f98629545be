package com.work.chainexec.txmgr.config;

import com.work.chainexec.core.chain.ChainRpcClient;
import com.work.chainexec.core.chain.TransactionSigner;
import com.work.chainexec.core.nonce.NonceAllocatorRegistry;
import com.work.chainexec.core.support.Sleeper;
import com.work.chainexec.txmgr.service.SubmissionPipeline;
import com.work.chainexec.txmgr.service.TxRegistry;
import com.work.chainexec.txmgr.service.gas.GasSpikeGuard;
import com.work.chainexec.txmgr.support.metrics.NoopTxMgrMetrics;
import com.work.chainexec.txmgr.support.metrics.TxMgrMetrics;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(TxMgrProperties.class)
public class TxMgrConfiguration {

    @Bean
    @ConditionalOnMissingBean(TxMgrMetrics.class)
    public TxMgrMetrics txMgrMetrics() {
        return new NoopTxMgrMetrics();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService nonceResyncExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "nonce-resync");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public NonceAllocatorRegistry nonceAllocatorRegistry(@Qualifier("nonceResyncExecutor") ExecutorService nonceResyncExecutor) {
        return new NonceAllocatorRegistry(nonceResyncExecutor);
    }

    @Bean
    public TxRegistry txRegistry(TxMgrProperties props) {
        return new TxRegistry(props.getRegistryCapacity());
    }

    @Bean
    public SubmissionPipeline submissionPipeline(ChainRpcClient chain,
                                                 TransactionSigner signer,
                                                 NonceAllocatorRegistry allocators,
                                                 TxRegistry registry,
                                                 TxMgrProperties props,
                                                 TxMgrMetrics metrics) {
        Clock clock = Clock.systemUTC();
        return new SubmissionPipeline(
                chain,
                signer,
                allocators.forAddress(chain, signer.getAddress()),
                registry,
                new GasSpikeGuard(chain, props, clock),
                props,
                metrics,
                Sleeper.threadSleep(),
                clock);
    }
}
