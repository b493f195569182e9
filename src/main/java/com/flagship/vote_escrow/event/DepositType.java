package com.flagship.vote_escrow.event;

/**
 * How a deposit event came about.
 */
public enum DepositType {
    CREATE_LOCK,
    DEPOSIT_FOR,
    INCREASE_AMOUNT,
    INCREASE_UNLOCK_TIME,
    MERGE,
    SPLIT
}
