package com.flagship.vote_escrow.lock;

import java.math.BigInteger;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Team-controlled parameters of the escrow.
 *
 * Values are read without locking by lock operations; changes go through
 * {@link EscrowAdminService}, which applies them under the store's writer lock.
 * Split permissions belong to the account they were granted to, so they follow
 * a position to its current owner rather than to whoever enabled them.
 */
public class EscrowGovernance {

    public static final int BASIS_POINTS = 10_000;

    private volatile UUID team;
    private volatile UUID pendingTeam;
    private volatile UUID earlyWithdrawTreasury;
    private volatile int earlyWithdrawPenaltyBps;
    private volatile BigInteger minLockAmount;
    private volatile boolean globalSplitEnabled;
    private final Set<UUID> splitAccounts = ConcurrentHashMap.newKeySet();

    public EscrowGovernance(UUID team, UUID earlyWithdrawTreasury, int earlyWithdrawPenaltyBps,
                            BigInteger minLockAmount, boolean globalSplitEnabled) {
        if (earlyWithdrawPenaltyBps < 0 || earlyWithdrawPenaltyBps > BASIS_POINTS) {
            throw new IllegalArgumentException("Penalty out of range: " + earlyWithdrawPenaltyBps);
        }
        if (minLockAmount == null || minLockAmount.signum() < 0) {
            throw new IllegalArgumentException("Minimum lock amount must not be negative");
        }
        this.team = team;
        this.earlyWithdrawTreasury = earlyWithdrawTreasury;
        this.earlyWithdrawPenaltyBps = earlyWithdrawPenaltyBps;
        this.minLockAmount = minLockAmount;
        this.globalSplitEnabled = globalSplitEnabled;
    }

    public UUID getTeam() {
        return team;
    }

    public UUID getPendingTeam() {
        return pendingTeam;
    }

    public UUID getEarlyWithdrawTreasury() {
        return earlyWithdrawTreasury;
    }

    public int getEarlyWithdrawPenaltyBps() {
        return earlyWithdrawPenaltyBps;
    }

    public BigInteger getMinLockAmount() {
        return minLockAmount;
    }

    public boolean isGlobalSplitEnabled() {
        return globalSplitEnabled;
    }

    public boolean canSplit(UUID owner) {
        return globalSplitEnabled || splitAccounts.contains(owner);
    }

    void setPendingTeam(UUID pendingTeam) {
        this.pendingTeam = pendingTeam;
    }

    void promotePendingTeam() {
        this.team = pendingTeam;
        this.pendingTeam = null;
    }

    void setEarlyWithdrawTreasury(UUID treasury) {
        this.earlyWithdrawTreasury = treasury;
    }

    void setEarlyWithdrawPenaltyBps(int penaltyBps) {
        this.earlyWithdrawPenaltyBps = penaltyBps;
    }

    void setMinLockAmount(BigInteger minLockAmount) {
        this.minLockAmount = minLockAmount;
    }

    void setGlobalSplitEnabled(boolean enabled) {
        this.globalSplitEnabled = enabled;
    }

    void setAccountSplitEnabled(UUID account, boolean enabled) {
        if (enabled) {
            splitAccounts.add(account);
        } else {
            splitAccounts.remove(account);
        }
    }
}
