package com.work.chainexec.relay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static com.work.chainexec.core.support.ValidationUtils.requireNonNull;

/**
 * relay 配置表：启动时构造一次并注入使用方，每种类型最多一个 relay。
 *
 * <p>选择规则：只取 enabled；按 priority 降序；隐私等级过滤类型；偏好 relay（若在可用集合中）排在最前。</p>
 */
public class RelayRegistry {

    private static final Logger log = LoggerFactory.getLogger(RelayRegistry.class);

    private static final Comparator<RelayConfig> BY_PRIORITY_DESC =
            Comparator.comparingInt(RelayConfig::getPriority).reversed();

    private final Map<RelayType, RelayConfig> relays = new ConcurrentHashMap<>();

    public RelayRegistry(Collection<RelayConfig> initial) {
        if (initial != null) {
            for (RelayConfig relay : initial) {
                addRelay(relay);
            }
        }
    }

    public void addRelay(RelayConfig relay) {
        requireNonNull(relay, "relay");
        relays.put(relay.getType(), relay);
        log.info("relay added type={} name={} priority={}", relay.getType(), relay.getName(), relay.getPriority());
    }

    public boolean removeRelay(RelayType type) {
        boolean removed = relays.remove(type) != null;
        if (removed) {
            log.info("relay removed type={}", type);
        }
        return removed;
    }

    public boolean enable(RelayType type) {
        return setEnabled(type, true);
    }

    public boolean disable(RelayType type) {
        return setEnabled(type, false);
    }

    public RelayConfig get(RelayType type) {
        return type == null ? null : relays.get(type);
    }

    public List<RelayConfig> all() {
        List<RelayConfig> list = new ArrayList<>(relays.values());
        list.sort(BY_PRIORITY_DESC);
        return list;
    }

    public List<RelayConfig> select(PrivacyLevel level, RelayType preferred) {
        PrivacyLevel effective = level == null ? PrivacyLevel.NONE : level;
        List<RelayConfig> selected = new ArrayList<>();
        RelayConfig preferredRelay = get(preferred);
        if (preferredRelay != null && preferredRelay.isEnabled() && preferredRelay.getType() != RelayType.PUBLIC_RPC) {
            selected.add(preferredRelay);
        }
        for (RelayConfig relay : all()) {
            if (relay.isEnabled() && effective.accepts(relay.getType()) && !selected.contains(relay)) {
                selected.add(relay);
            }
        }
        return selected;
    }

    /**
     * 接收 eth_sendBundle / eth_callBundle 的 relay：优先 Flashbots，其次 MEV-Share。
     */
    public RelayConfig bundleRelay() {
        RelayConfig flashbots = relays.get(RelayType.FLASHBOTS_PROTECT);
        if (flashbots != null && flashbots.isEnabled()) {
            return flashbots;
        }
        RelayConfig mevShare = relays.get(RelayType.MEV_SHARE);
        if (mevShare != null && mevShare.isEnabled()) {
            return mevShare;
        }
        return null;
    }

    private boolean setEnabled(RelayType type, boolean enabled) {
        RelayConfig relay = get(type);
        if (relay == null) {
            return false;
        }
        relay.setEnabled(enabled);
        log.info("relay {} type={}", enabled ? "enabled" : "disabled", type);
        return true;
    }
}
