package com.flagship.vote_escrow.lock;

/**
 * Lifecycle state of a position.
 *
 * ACTIVE positions decay towards their unlock time and may be withdrawn once it
 * has passed. PERMANENT positions hold constant weight until converted back.
 * WITHDRAWN is terminal: the id is never reused and its history is kept.
 */
public enum LockStatus {
    ACTIVE,
    PERMANENT,
    WITHDRAWN
}
