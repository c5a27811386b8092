package com.propertybooking.booking.domain.strategy;

import com.propertybooking.booking.domain.model.Property;
import com.propertybooking.booking.domain.repository.PropertyRepository;
import com.propertybooking.common.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PessimisticPropertyLockStrategyTest {

    @Mock
    private PropertyRepository propertyRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private PessimisticPropertyLockStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new PessimisticPropertyLockStrategy(propertyRepository, new TransactionTemplate(transactionManager));
    }

    @Test
    @DisplayName("locks the property row before running the action and commits afterwards")
    void executeLocked_locksThenRunsAction() {
        UUID propertyId = UUID.randomUUID();
        given(propertyRepository.findByIdForUpdate(propertyId))
                .willReturn(Optional.of(Property.builder().id(propertyId).propertyName("Villa").build()));

        String result = strategy.executeLocked(propertyId, () -> {
            verify(propertyRepository).findByIdForUpdate(propertyId);
            return "done";
        });

        assertThat(result).isEqualTo("done");
        InOrder order = inOrder(transactionManager, propertyRepository);
        order.verify(transactionManager).getTransaction(any());
        order.verify(propertyRepository).findByIdForUpdate(propertyId);
        order.verify(transactionManager).commit(any());
    }

    @Test
    void executeLocked_unknownPropertyRollsBack() {
        UUID propertyId = UUID.randomUUID();
        given(propertyRepository.findByIdForUpdate(propertyId)).willReturn(Optional.empty());

        assertThatThrownBy(() -> strategy.executeLocked(propertyId, () -> "never"))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
    }

    @Test
    void executeLocked_actionFailureRollsBack() {
        UUID propertyId = UUID.randomUUID();
        given(propertyRepository.findByIdForUpdate(propertyId))
                .willReturn(Optional.of(Property.builder().id(propertyId).propertyName("Villa").build()));

        assertThatThrownBy(() -> strategy.executeLocked(propertyId, () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);
        verify(transactionManager).rollback(any());
    }

    @Test
    void strategyType() {
        assertThat(strategy.getStrategyType()).isEqualTo("PESSIMISTIC_LOCK");
    }
}
