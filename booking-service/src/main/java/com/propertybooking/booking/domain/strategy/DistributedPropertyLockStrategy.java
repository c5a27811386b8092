package com.propertybooking.booking.domain.strategy;

import com.propertybooking.booking.domain.repository.PropertyRepository;
import com.propertybooking.common.exception.ResourceNotFoundException;
import com.propertybooking.common.exception.ServiceUnavailableException;
import com.propertybooking.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Coordinates booking writes through a Redis lock keyed by property id.
 *
 * The lock is taken before the transaction begins and released only after it has committed;
 * unlocking earlier would let the next writer run its overlap check before this booking is visible.
 * Failing to get the lock within the wait time is reported as a retryable 503.
 */
@Slf4j
@Component("distributed")
@ConditionalOnProperty(name = "booking.lock.strategy", havingValue = "distributed")
@RequiredArgsConstructor
public class DistributedPropertyLockStrategy implements PropertyLockStrategy {

    private final RedissonClient redissonClient;
    private final PropertyRepository propertyRepository;
    private final TransactionTemplate transactionTemplate;

    @Value("${booking.lock.wait-seconds:5}")
    private long waitSeconds;

    @Value("${booking.lock.lease-seconds:30}")
    private long leaseSeconds;

    @Override
    public <T> T executeLocked(UUID propertyId, Supplier<T> action) {
        String lockKey = buildLockKey(propertyId);
        RLock lock = redissonClient.getLock(lockKey);

        try {
            boolean acquired = lock.tryLock(waitSeconds, leaseSeconds, TimeUnit.SECONDS);
            if (!acquired) {
                throw new ServiceUnavailableException(
                        String.format("Property %s is busy with another booking change. Please try again.", propertyId));
            }
            log.debug("Acquired distributed lock: {}", lockKey);

            return transactionTemplate.execute(status -> {
                if (!propertyRepository.existsById(propertyId)) {
                    throw new ResourceNotFoundException("Property", propertyId);
                }
                return action.get();
            });
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException("Interrupted while waiting for property lock", e);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("Released distributed lock: {}", lockKey);
            }
        }
    }

    @Override
    public String getStrategyType() {
        return "DISTRIBUTED_LOCK";
    }

    private String buildLockKey(UUID propertyId) {
        return Constants.LOCK_PREFIX + propertyId;
    }
}
