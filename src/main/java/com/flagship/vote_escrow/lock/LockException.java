package com.flagship.vote_escrow.lock;

/**
 * Rejection of a lock operation or query.
 */
public class LockException extends RuntimeException {

    private final LockErrorCode code;

    public LockException(LockErrorCode code) {
        this(code, code.getDefaultMessage());
    }

    public LockException(LockErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public LockErrorCode getCode() {
        return code;
    }

    public static LockException of(LockErrorCode code, String format, Object... args) {
        return new LockException(code, code.getDefaultMessage() + ": " + String.format(format, args));
    }
}
