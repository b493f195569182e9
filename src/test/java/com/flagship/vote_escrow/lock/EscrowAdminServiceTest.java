package com.flagship.vote_escrow.lock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.math.BigInteger;

import static com.flagship.vote_escrow.lock.EscrowFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class EscrowAdminServiceTest {

    private EscrowFixture fixture;
    private EscrowAdminService adminService;
    private EscrowGovernance governance;

    private static void assertRejected(LockErrorCode expected, Executable action) {
        LockException e = assertThrows(LockException.class, action);
        assertEquals(expected, e.getCode());
    }

    @BeforeEach
    void setUp() {
        fixture = new EscrowFixture();
        adminService = fixture.adminService;
        governance = fixture.governance;
    }

    @Test
    @DisplayName("Team handover needs a proposal by the team and acceptance by the new team")
    void testTeamHandover() {
        assertRejected(LockErrorCode.NOT_TEAM, () -> adminService.proposeTeam(ALICE, BOB));

        adminService.proposeTeam(TEAM, BOB);
        assertEquals(BOB, governance.getPendingTeam());
        assertEquals(TEAM, governance.getTeam());

        assertRejected(LockErrorCode.NOT_PENDING_TEAM, () -> adminService.acceptTeam(ALICE));
        adminService.acceptTeam(BOB);

        assertEquals(BOB, governance.getTeam());
        assertNull(governance.getPendingTeam());
        assertRejected(LockErrorCode.NOT_TEAM, () -> adminService.setEarlyWithdrawPenalty(TEAM, 100));
        adminService.setEarlyWithdrawPenalty(BOB, 100);
        assertEquals(100, governance.getEarlyWithdrawPenaltyBps());
    }

    @Test
    @DisplayName("Penalty must stay within 0 and 10000 basis points")
    void testPenaltyBounds() {
        assertRejected(LockErrorCode.INVALID_PENALTY, () -> adminService.setEarlyWithdrawPenalty(TEAM, 10_001));
        assertRejected(LockErrorCode.INVALID_PENALTY, () -> adminService.setEarlyWithdrawPenalty(TEAM, -1));

        adminService.setEarlyWithdrawPenalty(TEAM, 10_000);
        assertEquals(10_000, governance.getEarlyWithdrawPenaltyBps());
    }

    @Test
    @DisplayName("Penalty and treasury changes apply to later early withdrawals")
    void testPenaltyAndTreasuryChangesApply() {
        long id = fixture.lockService.createLock(ALICE, units(1_000), 8 * WEEK);
        adminService.setEarlyWithdrawPenalty(TEAM, 2_000);
        adminService.setEarlyWithdrawTreasury(TEAM, CAROL);
        fixture.clock.advance(4 * WEEK);

        EarlyWithdrawal withdrawal = fixture.lockService.earlyWithdraw(ALICE, id);

        assertEquals(units(100), withdrawal.getPenalty());
        assertEquals(CAROL, withdrawal.getTreasury());
        assertEquals(units(100), fixture.vault.balanceOf(CAROL));
        assertEquals(BigInteger.ZERO, fixture.vault.balanceOf(TREASURY));
    }

    @Test
    @DisplayName("Split toggles distinguish one account from everyone")
    void testToggleSplit() {
        adminService.toggleSplit(TEAM, ALICE, true);
        assertTrue(governance.canSplit(ALICE));
        assertFalse(governance.canSplit(BOB));

        adminService.toggleSplit(TEAM, null, true);
        assertTrue(governance.canSplit(BOB));

        adminService.toggleSplit(TEAM, null, false);
        adminService.toggleSplit(TEAM, ALICE, false);
        assertFalse(governance.canSplit(ALICE));
        assertRejected(LockErrorCode.NOT_TEAM, () -> adminService.toggleSplit(ALICE, ALICE, true));
    }

    @Test
    @DisplayName("Minimum lock amount and treasury require valid values")
    void testParameterValidation() {
        assertRejected(LockErrorCode.ZERO_AMOUNT, () -> adminService.setMinLockAmount(TEAM, BigInteger.ZERO));
        assertRejected(LockErrorCode.ZERO_ADDRESS, () -> adminService.setEarlyWithdrawTreasury(TEAM, null));
        assertRejected(LockErrorCode.NOT_TEAM, () -> adminService.setMinLockAmount(null, BigInteger.TEN));

        adminService.setMinLockAmount(TEAM, BigInteger.TEN);
        assertEquals(BigInteger.TEN, governance.getMinLockAmount());
    }
}
