package com.work.chainexec.relay;

import static com.work.chainexec.core.support.ValidationUtils.requireNonEmpty;
import static com.work.chainexec.core.support.ValidationUtils.requireNonNull;

/**
 * 单个 relay 的静态配置。运行期只允许切换 enabled。
 */
public class RelayConfig {

    private final RelayType type;
    private final String name;
    private final String endpoint;
    private final int priority;
    private volatile boolean enabled;

    public RelayConfig(RelayType type, String name, String endpoint, int priority, boolean enabled) {
        this.type = requireNonNull(type, "type");
        this.endpoint = requireNonEmpty(endpoint, "endpoint");
        this.name = name == null ? type.name() : name;
        this.priority = priority;
        this.enabled = enabled;
    }

    public RelayType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isEnabled() {
        return enabled;
    }

    void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public String toString() {
        return "RelayConfig{type=" + type + ", name=" + name + ", endpoint=" + endpoint
                + ", priority=" + priority + ", enabled=" + enabled + "}";
    }
}
