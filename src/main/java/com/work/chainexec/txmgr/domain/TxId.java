package com.work.chainexec.txmgr.domain;

import java.util.Objects;

/**
 * 登记表句柄：槽位下标 + 代数。槽位被回收后代数递增，旧句柄不会再命中新条目。
 */
public final class TxId {

    private static final String PREFIX = "tx-";

    private final int slot;
    private final long generation;

    public TxId(int slot, long generation) {
        this.slot = slot;
        this.generation = generation;
    }

    /**
     * 解析 tx-&lt;slot&gt;-&lt;generation&gt;；格式不对返回 null。
     */
    public static TxId parse(String text) {
        if (text == null || !text.startsWith(PREFIX)) {
            return null;
        }
        String[] parts = text.substring(PREFIX.length()).split("-");
        if (parts.length != 2) {
            return null;
        }
        try {
            int slot = Integer.parseInt(parts[0]);
            long generation = Long.parseLong(parts[1]);
            if (slot < 0 || generation < 0) {
                return null;
            }
            return new TxId(slot, generation);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public int getSlot() {
        return slot;
    }

    public long getGeneration() {
        return generation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TxId)) return false;
        TxId txId = (TxId) o;
        return slot == txId.slot && generation == txId.generation;
    }

    @Override
    public int hashCode() {
        return Objects.hash(slot, generation);
    }

    @Override
    public String toString() {
        return PREFIX + slot + "-" + generation;
    }
}
