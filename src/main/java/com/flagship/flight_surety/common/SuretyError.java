package com.flagship.flight_surety.common;

/**
 * Rejection codes for core operations.
 *
 * Every code is a synchronous rejection of the triggering call; no state is changed
 * when one is raised.
 */
public enum SuretyError {
    NOT_OPERATIONAL(Category.ACCESS),
    UNAUTHORIZED(Category.ACCESS),
    NOT_AUTHORIZED_AIRLINE(Category.ACCESS),
    ALREADY_REGISTERED(Category.CONFLICT),
    ALREADY_FUNDED(Category.CONFLICT),
    DUPLICATE_VOTE(Category.CONFLICT),
    INSUFFICIENT_PAYMENT(Category.FUNDING),
    INVALID_AMOUNT(Category.INVALID),
    INVALID_BUYER(Category.INVALID),
    DUPLICATE_CLAIM(Category.CONFLICT),
    UNKNOWN_FLIGHT(Category.NOT_FOUND),
    FLIGHT_ALREADY_EXISTS(Category.CONFLICT),
    FLIGHT_NOT_INSURABLE(Category.CONFLICT),
    STATUS_FROZEN(Category.CONFLICT),
    UNKNOWN_ORACLE(Category.NOT_FOUND),
    INDEX_MISMATCH(Category.ACCESS),
    NO_MATCHING_REQUEST(Category.NOT_FOUND),
    INSUFFICIENT_CREDIT(Category.FUNDING),
    POOL_UNDERFUNDED(Category.FUNDING),
    TRANSFER_FAILED(Category.FUNDING);

    /**
     * Coarse grouping used when mapping a code to a transport status.
     */
    public enum Category {
        ACCESS,
        NOT_FOUND,
        CONFLICT,
        FUNDING,
        INVALID
    }

    private final Category category;

    SuretyError(Category category) {
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }
}
