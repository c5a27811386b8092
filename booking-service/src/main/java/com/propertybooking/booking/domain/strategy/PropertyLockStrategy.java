package com.propertybooking.booking.domain.strategy;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Per-property mutual exclusion for booking writes.
 *
 * Implementations (bean names):
 * - pessimistic: SELECT FOR UPDATE on the property row
 * - distributed: Redisson lock held around the transaction
 *
 * The action always runs inside a single transaction that commits before the lock is released,
 * so a check-then-write sequence inside it sees every committed booking of the property.
 */
public interface PropertyLockStrategy {

    /**
     * Runs {@code action} transactionally while holding the property's lock.
     *
     * @throws com.propertybooking.common.exception.ResourceNotFoundException if the property does not exist
     */
    <T> T executeLocked(UUID propertyId, Supplier<T> action);

    String getStrategyType();
}
