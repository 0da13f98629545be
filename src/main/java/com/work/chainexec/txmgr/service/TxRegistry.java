package com.work.chainexec.txmgr.service;

import com.work.chainexec.txmgr.domain.TransactionMetadata;
import com.work.chainexec.txmgr.domain.TxId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 交易登记表：槽位数组 + 代数。
 *
 * <ul>
 *   <li>{@link #create()} 优先复用空闲槽位；容量已满时回收最早进入的终态条目，仍无可回收则扩容</li>
 *   <li>{@link #release(TxId)} 让槽位代数 +1，旧 id 之后一律查不到</li>
 *   <li>查询 / 释放都是 O(1)；回收最早终态条目需要按分配顺序扫描</li>
 * </ul>
 */
public class TxRegistry {

    private static final Logger log = LoggerFactory.getLogger(TxRegistry.class);

    private final int capacity;
    private final List<Slot> slots = new ArrayList<>();
    private final Deque<Integer> freeSlots = new ArrayDeque<>();
    // 占用中的槽位，按分配先后
    private final Set<Integer> occupied = new LinkedHashSet<>();

    public TxRegistry(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity 必须大于0");
        }
        this.capacity = capacity;
    }

    public synchronized TransactionMetadata create() {
        int index;
        if (!freeSlots.isEmpty()) {
            index = freeSlots.pollFirst();
        } else if (slots.size() < capacity || !recycleOldestTerminal()) {
            if (slots.size() >= capacity) {
                log.warn("tx registry over capacity, growing capacity={} size={}", capacity, slots.size());
            }
            slots.add(new Slot());
            index = slots.size() - 1;
        } else {
            index = freeSlots.pollFirst();
        }
        Slot slot = slots.get(index);
        TransactionMetadata metadata = new TransactionMetadata(new TxId(index, slot.generation));
        slot.entry = metadata;
        occupied.add(index);
        return metadata;
    }

    /**
     * 按 id 查找；槽位已被释放或复用（代数不一致）时返回 null。
     */
    public synchronized TransactionMetadata get(TxId id) {
        if (id == null || id.getSlot() < 0 || id.getSlot() >= slots.size()) {
            return null;
        }
        Slot slot = slots.get(id.getSlot());
        if (slot.generation != id.getGeneration() || slot.entry == null) {
            return null;
        }
        return slot.entry;
    }

    public synchronized boolean release(TxId id) {
        if (get(id) == null) {
            return false;
        }
        Slot slot = slots.get(id.getSlot());
        slot.entry = null;
        slot.generation++;
        freeSlots.addLast(id.getSlot());
        occupied.remove(Integer.valueOf(id.getSlot()));
        return true;
    }

    public synchronized int size() {
        return occupied.size();
    }

    private boolean recycleOldestTerminal() {
        Iterator<Integer> it = occupied.iterator();
        while (it.hasNext()) {
            int index = it.next();
            Slot slot = slots.get(index);
            if (slot.entry != null && slot.entry.getState().isTerminal()) {
                it.remove();
                slot.entry = null;
                slot.generation++;
                freeSlots.addLast(index);
                return true;
            }
        }
        return false;
    }

    private static final class Slot {
        private long generation;
        private TransactionMetadata entry;
    }
}
