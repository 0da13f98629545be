package com.work.chainexec.relay;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RelayRegistryTest {

    private static RelayConfig relay(RelayType type, int priority) {
        return new RelayConfig(type, null, "https://relay.example/" + type, priority, true);
    }

    private static RelayRegistry registry() {
        return new RelayRegistry(Arrays.asList(
                relay(RelayType.BUILDER_RPC, 50),
                relay(RelayType.FLASHBOTS_PROTECT, 100),
                relay(RelayType.MEV_SHARE, 90)));
    }

    @Test
    public void all_is_sorted_by_priority_descending() {
        List<RelayConfig> all = registry().all();
        assertEquals(RelayType.FLASHBOTS_PROTECT, all.get(0).getType());
        assertEquals(RelayType.MEV_SHARE, all.get(1).getType());
        assertEquals(RelayType.BUILDER_RPC, all.get(2).getType());
    }

    @Test
    public void privacy_level_filters_relay_types() {
        RelayRegistry r = registry();
        assertEquals(1, r.select(PrivacyLevel.BASIC, null).size());
        assertEquals(RelayType.FLASHBOTS_PROTECT, r.select(PrivacyLevel.BASIC, null).get(0).getType());

        List<RelayConfig> enhanced = r.select(PrivacyLevel.ENHANCED, null);
        assertEquals(2, enhanced.size());
        assertEquals(RelayType.MEV_SHARE, enhanced.get(0).getType());

        assertEquals(RelayType.BUILDER_RPC, r.select(PrivacyLevel.MAXIMUM, null).get(0).getType());
        assertTrue(r.select(PrivacyLevel.NONE, null).isEmpty());
    }

    @Test
    public void preferred_relay_goes_first_without_duplication() {
        List<RelayConfig> selected = registry().select(PrivacyLevel.ENHANCED, RelayType.BUILDER_RPC);
        assertEquals(2, selected.size());
        assertEquals(RelayType.BUILDER_RPC, selected.get(0).getType());
        assertEquals(RelayType.MEV_SHARE, selected.get(1).getType());
    }

    @Test
    public void disabled_relays_are_skipped() {
        RelayRegistry r = registry();
        assertTrue(r.disable(RelayType.FLASHBOTS_PROTECT));
        assertTrue(r.select(PrivacyLevel.BASIC, RelayType.FLASHBOTS_PROTECT).isEmpty());
        assertEquals(RelayType.MEV_SHARE, r.bundleRelay().getType());

        assertTrue(r.enable(RelayType.FLASHBOTS_PROTECT));
        assertEquals(RelayType.FLASHBOTS_PROTECT, r.bundleRelay().getType());
        assertFalse(r.enable(RelayType.PUBLIC_RPC));
    }

    @Test
    public void bundle_relay_absent_without_flashbots_or_mev_share() {
        RelayRegistry r = new RelayRegistry(Arrays.asList(relay(RelayType.BUILDER_RPC, 50)));
        assertNull(r.bundleRelay());
        assertTrue(r.removeRelay(RelayType.BUILDER_RPC));
        assertTrue(r.all().isEmpty());
    }
}
