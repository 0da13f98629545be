package com.work.chainexec.crosschain.domain;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 有序 hop 列表，交给编排器后不再变化。
 */
public final class CrossChainPath {

    private final String id;
    private final List<Hop> hops;
    private final BigInteger expectedProfit;

    public CrossChainPath(String id, List<Hop> hops, BigInteger expectedProfit) {
        if (hops == null || hops.isEmpty()) {
            throw new IllegalArgumentException("hops 不能为空");
        }
        for (Hop hop : hops) {
            if (hop == null) {
                throw new IllegalArgumentException("hops 不能包含 null");
            }
        }
        this.id = id;
        this.hops = Collections.unmodifiableList(new ArrayList<>(hops));
        this.expectedProfit = expectedProfit == null ? BigInteger.ZERO : expectedProfit;
    }

    public static CrossChainPath of(Hop... hops) {
        List<Hop> list = new ArrayList<>();
        Collections.addAll(list, hops);
        return new CrossChainPath(null, list, null);
    }

    public String getId() {
        return id;
    }

    public List<Hop> getHops() {
        return hops;
    }

    public Hop firstHop() {
        return hops.get(0);
    }

    public BigInteger getExpectedProfit() {
        return expectedProfit;
    }

    public int getBridgeCount() {
        int n = 0;
        for (Hop hop : hops) {
            if (hop.isBridge()) {
                n++;
            }
        }
        return n;
    }

    public Set<Long> getChains() {
        Set<Long> chains = new LinkedHashSet<>();
        for (Hop hop : hops) {
            chains.add(hop.getChainId());
            if (hop.getToChainId() != null) {
                chains.add(hop.getToChainId());
            }
        }
        return chains;
    }

    @Override
    public String toString() {
        return "CrossChainPath{id=" + id + ", hops=" + hops + "}";
    }
}
