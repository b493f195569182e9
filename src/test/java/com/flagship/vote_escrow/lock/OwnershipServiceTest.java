package com.flagship.vote_escrow.lock;

import com.flagship.vote_escrow.event.PositionTransferredEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.flagship.vote_escrow.lock.EscrowFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class OwnershipServiceTest {

    private EscrowFixture fixture;
    private OwnershipService ownershipService;
    private LockService lockService;
    private LockQueryService queryService;
    private long positionId;

    @BeforeEach
    void setUp() {
        fixture = new EscrowFixture();
        ownershipService = fixture.ownershipService;
        lockService = fixture.lockService;
        queryService = fixture.queryService;
        positionId = lockService.createLock(ALICE, units(100), 20 * WEEK);
    }

    @Test
    @DisplayName("Approved delegate may manage the position but not re-approve it")
    void testApprovedDelegate() {
        ownershipService.approve(ALICE, positionId, BOB);

        assertTrue(ownershipService.isApprovedOrOwner(BOB, positionId));
        lockService.increaseAmount(BOB, positionId, units(10));
        assertEquals(units(110), queryService.locked(positionId).getAmount());

        LockException e = assertThrows(LockException.class,
            () -> ownershipService.approve(BOB, positionId, CAROL));
        assertEquals(LockErrorCode.NOT_APPROVED_OR_OWNER, e.getCode());

        ownershipService.approve(ALICE, positionId, null);
        assertFalse(ownershipService.isApprovedOrOwner(BOB, positionId));
    }

    @Test
    @DisplayName("Operators act on every position of the owner")
    void testOperatorApproval() {
        long second = lockService.createLock(ALICE, units(50), 20 * WEEK);
        ownershipService.setApprovalForAll(ALICE, CAROL, true);

        assertTrue(ownershipService.isApprovedOrOwner(CAROL, positionId));
        assertTrue(ownershipService.isApprovedOrOwner(CAROL, second));
        ownershipService.approve(CAROL, second, BOB);
        assertEquals(BOB, queryService.position(second).getApproved());

        ownershipService.setApprovalForAll(ALICE, CAROL, false);
        assertFalse(ownershipService.isApprovedOrOwner(CAROL, positionId));
        assertThrows(IllegalArgumentException.class, () -> ownershipService.setApprovalForAll(ALICE, ALICE, true));
    }

    @Test
    @DisplayName("Transfers move ownership, clear the delegate and keep the balance")
    void testTransfer() {
        ownershipService.approve(ALICE, positionId, CAROL);
        BigInteger balance = queryService.balanceOf(positionId);
        int userEpoch = queryService.userPointEpoch(positionId);

        ownershipService.transferFrom(ALICE, ALICE, BOB, positionId);

        assertEquals(BOB, queryService.ownerOf(positionId));
        assertNull(queryService.position(positionId).getApproved());
        assertEquals(balance, queryService.balanceOf(positionId));
        assertEquals(userEpoch, queryService.userPointEpoch(positionId));
        assertTrue(queryService.positionsOf(ALICE).isEmpty());
        assertEquals(1, queryService.positionsOf(BOB).size());
        assertTrue(fixture.outboxService.getEventsForPosition(positionId).stream()
            .anyMatch(event -> PositionTransferredEvent.EVENT_TYPE.equals(event.getEventType())));

        LockException e = assertThrows(LockException.class,
            () -> lockService.increaseAmount(ALICE, positionId, units(1)));
        assertEquals(LockErrorCode.NOT_APPROVED_OR_OWNER, e.getCode());
    }

    @Test
    @DisplayName("Transfers are rejected for strangers, wrong owners and withdrawn positions")
    void testTransferRejections() {
        LockException stranger = assertThrows(LockException.class,
            () -> ownershipService.transferFrom(BOB, ALICE, BOB, positionId));
        assertEquals(LockErrorCode.NOT_APPROVED_OR_OWNER, stranger.getCode());

        LockException wrongOwner = assertThrows(LockException.class,
            () -> ownershipService.transferFrom(ALICE, BOB, CAROL, positionId));
        assertEquals(LockErrorCode.NOT_APPROVED_OR_OWNER, wrongOwner.getCode());

        LockException zeroAddress = assertThrows(LockException.class,
            () -> ownershipService.transferFrom(ALICE, ALICE, null, positionId));
        assertEquals(LockErrorCode.ZERO_ADDRESS, zeroAddress.getCode());

        fixture.clock.advance(20 * WEEK);
        lockService.withdraw(ALICE, positionId);
        LockException withdrawn = assertThrows(LockException.class,
            () -> ownershipService.transferFrom(ALICE, ALICE, BOB, positionId));
        assertEquals(LockErrorCode.WITHDRAWN, withdrawn.getCode());
    }
}
