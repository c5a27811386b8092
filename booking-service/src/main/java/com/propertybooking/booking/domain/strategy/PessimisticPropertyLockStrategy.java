package com.propertybooking.booking.domain.strategy;

import com.propertybooking.booking.domain.repository.PropertyRepository;
import com.propertybooking.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Locks the property row with SELECT FOR UPDATE. The row lock lives exactly as long as the
 * transaction, so writers to the same property queue up in the database while other properties
 * proceed in parallel. Works across any number of service instances sharing the database.
 */
@Slf4j
@Component("pessimistic")
@RequiredArgsConstructor
public class PessimisticPropertyLockStrategy implements PropertyLockStrategy {

    private final PropertyRepository propertyRepository;
    private final TransactionTemplate transactionTemplate;

    @Override
    public <T> T executeLocked(UUID propertyId, Supplier<T> action) {
        return transactionTemplate.execute(status -> {
            propertyRepository.findByIdForUpdate(propertyId)
                    .orElseThrow(() -> new ResourceNotFoundException("Property", propertyId));
            log.debug("Acquired row lock on property {}", propertyId);
            return action.get();
        });
    }

    @Override
    public String getStrategyType() {
        return "PESSIMISTIC_LOCK";
    }
}
