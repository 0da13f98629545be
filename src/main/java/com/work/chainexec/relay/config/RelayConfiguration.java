package com.work.chainexec.relay.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.chainexec.core.chain.ChainRpcClient;
import com.work.chainexec.core.chain.TransactionSigner;
import com.work.chainexec.core.nonce.NonceAllocatorRegistry;
import com.work.chainexec.core.support.Sleeper;
import com.work.chainexec.relay.RelayConfig;
import com.work.chainexec.relay.RelayRegistry;
import com.work.chainexec.relay.RelaySubmitter;
import com.work.chainexec.relay.RelayType;
import com.work.chainexec.relay.transport.HttpRelayTransport;
import com.work.chainexec.relay.transport.RelayTransport;
import com.work.chainexec.txmgr.support.metrics.TxMgrMetrics;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.web3j.crypto.Credentials;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * relay 装配。未配置 relay.relays 时注册主网默认端点。
 */
@Configuration
@EnableConfigurationProperties(RelayProperties.class)
public class RelayConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RelayConfiguration.class);

    static final String FLASHBOTS_PROTECT_ENDPOINT = "https://rpc.flashbots.net";
    static final String MEV_SHARE_ENDPOINT = "https://relay.flashbots.net";

    @Bean
    public RelayRegistry relayRegistry(RelayProperties props) {
        return new RelayRegistry(relayConfigs(props));
    }

    @Bean
    @ConditionalOnMissingBean(RelayTransport.class)
    public RelayTransport relayTransport(RelayProperties props, ObjectMapper objectMapper) {
        OkHttpClient http = new OkHttpClient.Builder()
                .callTimeout(props.getRequestTimeout())
                .build();
        Credentials authKey = null;
        if (StringUtils.hasText(props.getAuthPrivateKey())) {
            authKey = Credentials.create(props.getAuthPrivateKey());
            log.info("relay requests signed by reputation key address={}", authKey.getAddress());
        }
        return new HttpRelayTransport(http, objectMapper, authKey);
    }

    @Bean
    public RelaySubmitter relaySubmitter(RelayRegistry registry,
                                         RelayTransport transport,
                                         ChainRpcClient chain,
                                         TransactionSigner signer,
                                         NonceAllocatorRegistry allocators,
                                         RelayProperties props,
                                         TxMgrMetrics metrics) {
        return new RelaySubmitter(
                registry,
                transport,
                chain,
                signer,
                allocators.forAddress(chain, signer.getAddress()),
                props,
                metrics,
                Sleeper.threadSleep(),
                Clock.systemUTC());
    }

    static List<RelayConfig> relayConfigs(RelayProperties props) {
        List<RelayConfig> configs = new ArrayList<>();
        if (props.getRelays() == null || props.getRelays().isEmpty()) {
            configs.add(new RelayConfig(RelayType.FLASHBOTS_PROTECT, "flashbots-protect", FLASHBOTS_PROTECT_ENDPOINT, 100, true));
            configs.add(new RelayConfig(RelayType.MEV_SHARE, "mev-share", MEV_SHARE_ENDPOINT, 90, true));
            return configs;
        }
        for (RelayProperties.Entry e : props.getRelays()) {
            configs.add(new RelayConfig(e.getType(), e.getName(), e.getEndpoint(), e.getPriority(), e.isEnabled()));
        }
        return configs;
    }
}
