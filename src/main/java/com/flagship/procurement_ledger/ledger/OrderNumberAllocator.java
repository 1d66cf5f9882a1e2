package com.flagship.procurement_ledger.ledger;

/**
 * Hands out order sequence values with atomic reserve-and-increment semantics.
 *
 * A reserved value is never handed out twice. Implementations backed by a database
 * are expected to take part in the caller's transaction so that a rolled back append
 * also releases its value.
 */
public interface OrderNumberAllocator {

    /**
     * Reserves the next sequence value (1 for the first request ever appended).
     */
    long reserveNext();
}
