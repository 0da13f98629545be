package com.work.chainexec.txmgr.service;

import com.work.chainexec.txmgr.domain.TransactionMetadata;
import com.work.chainexec.txmgr.domain.TxId;
import com.work.chainexec.txmgr.domain.TxState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TxRegistryTest {

    @Test
    public void created_entries_are_found_by_id() {
        TxRegistry registry = new TxRegistry(4);
        TransactionMetadata a = registry.create();
        TransactionMetadata b = registry.create();

        assertNotEquals(a.getId(), b.getId());
        assertSame(a, registry.get(a.getId()));
        assertSame(b, registry.get(TxId.parse(b.getId().toString())));
        assertEquals(2, registry.size());
    }

    @Test
    public void released_id_is_stale_after_slot_reuse() {
        TxRegistry registry = new TxRegistry(4);
        TransactionMetadata a = registry.create();
        TxId old = a.getId();

        assertTrue(registry.release(old));
        assertFalse(registry.release(old));
        TransactionMetadata reused = registry.create();

        assertEquals(old.getSlot(), reused.getId().getSlot());
        assertEquals(old.getGeneration() + 1, reused.getId().getGeneration());
        assertNull(registry.get(old));
        assertSame(reused, registry.get(reused.getId()));
    }

    @Test
    public void full_registry_recycles_oldest_terminal_entry() {
        TxRegistry registry = new TxRegistry(2);
        TransactionMetadata a = registry.create();
        TransactionMetadata b = registry.create();
        b.setState(TxState.CONFIRMED);

        TransactionMetadata c = registry.create();

        assertEquals(b.getId().getSlot(), c.getId().getSlot());
        assertNull(registry.get(b.getId()));
        assertSame(a, registry.get(a.getId()));
        assertEquals(2, registry.size());
    }

    @Test
    public void reused_slot_moves_to_back_of_recycle_order() {
        TxRegistry registry = new TxRegistry(2);
        TransactionMetadata a = registry.create();
        TransactionMetadata b = registry.create();
        registry.release(a.getId());
        TransactionMetadata a2 = registry.create();
        a2.setState(TxState.FAILED);
        b.setState(TxState.CONFIRMED);

        TransactionMetadata c = registry.create();

        // b 比复用后的 a2 更早进入，先被回收
        assertEquals(b.getId().getSlot(), c.getId().getSlot());
        assertSame(a2, registry.get(a2.getId()));
        assertEquals(2, registry.size());
    }

    @Test
    public void full_registry_without_terminal_entries_grows() {
        TxRegistry registry = new TxRegistry(1);
        TransactionMetadata a = registry.create();
        TransactionMetadata b = registry.create();

        assertSame(a, registry.get(a.getId()));
        assertSame(b, registry.get(b.getId()));
        assertEquals(2, registry.size());
    }

    @Test
    public void unknown_or_malformed_ids_return_null() {
        TxRegistry registry = new TxRegistry(2);
        assertNull(registry.get(null));
        assertNull(registry.get(new TxId(7, 0)));
        assertNull(TxId.parse("tx-abc"));
        assertNull(TxId.parse("0x1234"));
    }
}
