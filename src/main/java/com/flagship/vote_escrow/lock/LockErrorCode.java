package com.flagship.vote_escrow.lock;

/**
 * Reasons a lock operation can be rejected.
 *
 * Every rejection happens before any state is committed, so the caller may retry
 * with corrected input or once the precondition holds.
 */
public enum LockErrorCode {

    ZERO_AMOUNT(Category.VALIDATION, "Amount must be positive"),
    ZERO_ADDRESS(Category.VALIDATION, "Holder address is required"),
    AMOUNT_TOO_SMALL(Category.VALIDATION, "Amount is below the minimum lock amount"),
    LOCK_TOO_SHORT(Category.VALIDATION, "Lock duration is below the minimum"),
    LOCK_TOO_LONG(Category.VALIDATION, "Lock duration exceeds the maximum"),
    DEPOSIT_DURATION_TOO_SHORT(Category.VALIDATION, "Remaining lock duration is below the minimum for deposits"),
    UNLOCK_TIME_NOT_LATER(Category.VALIDATION, "New unlock time must be later than the current one"),
    AMOUNT_TOO_LARGE(Category.VALIDATION, "Split amount must be below the locked amount"),
    SAME_POSITION(Category.VALIDATION, "Cannot merge a position into itself"),
    INVALID_PENALTY(Category.VALIDATION, "Penalty must be between 0 and 10000 basis points"),

    NOT_APPROVED_OR_OWNER(Category.AUTHORIZATION, "Caller is neither owner nor approved"),
    SPLIT_NOT_ALLOWED(Category.AUTHORIZATION, "Splitting is not enabled for the position owner"),
    NOT_TEAM(Category.AUTHORIZATION, "Caller is not the team"),
    NOT_PENDING_TEAM(Category.AUTHORIZATION, "Caller is not the pending team"),

    NON_EXISTENT(Category.STATE, "Position does not exist"),
    ALREADY_PERMANENT(Category.STATE, "Position is permanently locked"),
    NOT_PERMANENT(Category.STATE, "Position is not permanently locked"),
    EXPIRED(Category.STATE, "Lock has expired"),
    NOT_EXPIRED(Category.STATE, "Lock has not expired yet"),
    WITHDRAWN(Category.STATE, "Position has been withdrawn"),
    TREASURY_NOT_SET(Category.STATE, "Early withdraw treasury is not configured"),

    REPLAY_LIMIT_EXCEEDED(Category.ARITHMETIC, "Supply replay exceeds the maximum number of weeks");

    public enum Category {
        VALIDATION,
        AUTHORIZATION,
        STATE,
        ARITHMETIC
    }

    private final Category category;
    private final String defaultMessage;

    LockErrorCode(Category category, String defaultMessage) {
        this.category = category;
        this.defaultMessage = defaultMessage;
    }

    public Category getCategory() {
        return category;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
