package com.flagship.vote_escrow.lock;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.UUID;

/**
 * Team-only parameter changes.
 *
 * Team handover is two-step: the current team proposes, the proposed account accepts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscrowAdminService {

    private final EscrowStore store;
    private final EscrowGovernance governance;

    public void proposeTeam(UUID caller, UUID newTeam) {
        requireTeam(caller);
        LockService.requireHolder(newTeam);
        store.exclusive(() -> governance.setPendingTeam(newTeam));
        log.info("Team change proposed: current={}, pending={}", caller, newTeam);
    }

    public void acceptTeam(UUID caller) {
        store.exclusive(() -> {
            if (caller == null || !caller.equals(governance.getPendingTeam())) {
                throw LockException.of(LockErrorCode.NOT_PENDING_TEAM, "caller=%s", caller);
            }
            governance.promotePendingTeam();
        });
        log.info("Team change accepted: team={}", caller);
    }

    /**
     * Enables or disables splitting for one account, or for everyone when
     * {@code account} is null.
     */
    public void toggleSplit(UUID caller, UUID account, boolean enabled) {
        requireTeam(caller);
        store.exclusive(() -> {
            if (account == null) {
                governance.setGlobalSplitEnabled(enabled);
            } else {
                governance.setAccountSplitEnabled(account, enabled);
            }
        });
        log.info("Split permission changed: account={}, enabled={}", account == null ? "*" : account, enabled);
    }

    public void setEarlyWithdrawTreasury(UUID caller, UUID treasury) {
        requireTeam(caller);
        LockService.requireHolder(treasury);
        store.exclusive(() -> governance.setEarlyWithdrawTreasury(treasury));
        log.info("Early withdraw treasury set: treasury={}", treasury);
    }

    public void setEarlyWithdrawPenalty(UUID caller, int penaltyBps) {
        requireTeam(caller);
        if (penaltyBps < 0 || penaltyBps > EscrowGovernance.BASIS_POINTS) {
            throw LockException.of(LockErrorCode.INVALID_PENALTY, "penaltyBps=%d", penaltyBps);
        }
        store.exclusive(() -> governance.setEarlyWithdrawPenaltyBps(penaltyBps));
        log.info("Early withdraw penalty set: penaltyBps={}", penaltyBps);
    }

    public void setMinLockAmount(UUID caller, BigInteger minLockAmount) {
        requireTeam(caller);
        if (minLockAmount == null || minLockAmount.signum() <= 0) {
            throw new LockException(LockErrorCode.ZERO_AMOUNT);
        }
        store.exclusive(() -> governance.setMinLockAmount(minLockAmount));
        log.info("Minimum lock amount set: minLockAmount={}", minLockAmount);
    }

    private void requireTeam(UUID caller) {
        if (caller == null || !caller.equals(governance.getTeam())) {
            throw LockException.of(LockErrorCode.NOT_TEAM, "caller=%s", caller);
        }
    }
}
