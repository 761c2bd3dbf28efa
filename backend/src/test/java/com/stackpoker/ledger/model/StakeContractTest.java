package com.stackpoker.ledger.model;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StakeContractTest {

    @Test
    void manualStakerRefClearsAppUserColumn() {
        UUID profileId = UUID.randomUUID();
        StakeContract stake = new StakeContract();
        stake.setStakerRef(StakerRef.appUser("player-bob"));

        stake.setStakerRef(StakerRef.manualStaker(profileId, "Uncle Ray"));

        assertNull(stake.getStakerUserId());
        assertEquals(profileId, stake.getManualStakerId());
        assertEquals("Uncle Ray", stake.getStakerDisplayName());
        assertTrue(stake.isOffAppStaker());
        assertEquals(StakerRef.manualStaker(profileId, "Uncle Ray"), stake.getStakerRef());
    }

    @Test
    void appUserRefRoundTripsThroughColumns() {
        StakeContract stake = new StakeContract();

        stake.setStakerRef(StakerRef.appUser("player-bob"));

        assertFalse(stake.isOffAppStaker());
        assertNull(stake.getManualStakerId());
        assertEquals(new StakerRef.AppUser("player-bob"), stake.getStakerRef());
    }

    @Test
    void refsRequireIdentity() {
        assertThrows(NullPointerException.class, () -> StakerRef.appUser(null));
        assertThrows(NullPointerException.class, () -> StakerRef.manualStaker(null, "Uncle Ray"));
    }

    @Test
    void unresolvedStatusesAreProposedAndAwaiting() {
        assertTrue(StakeStatus.PROPOSED.isUnresolved());
        assertTrue(StakeStatus.AWAITING_SETTLEMENT.isUnresolved());
        assertFalse(StakeStatus.SETTLED.isUnresolved());
        assertFalse(StakeStatus.DECLINED.isUnresolved());
        assertFalse(StakeStatus.CANCELLED.isUnresolved());
    }
}
