package com.ivamare.cqrs.transaction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.SimpleTransactionStatus;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SpringTransactionManager")
class SpringTransactionManagerTest {

    @Mock
    private PlatformTransactionManager platformTransactionManager;

    @Test
    @DisplayName("should commit after successful work")
    void shouldCommitOnSuccess() {
        TransactionStatus status = new SimpleTransactionStatus();
        when(platformTransactionManager.getTransaction(any())).thenReturn(status);
        SpringTransactionManager manager = new SpringTransactionManager(platformTransactionManager);

        String value = manager.withinTransaction(() -> "done");

        assertEquals("done", value);
        verify(platformTransactionManager).commit(status);
        verify(platformTransactionManager, never()).rollback(any());
    }

    @Test
    @DisplayName("should roll back and rethrow when work fails")
    void shouldRollbackOnFailure() {
        TransactionStatus status = new SimpleTransactionStatus();
        when(platformTransactionManager.getTransaction(any())).thenReturn(status);
        SpringTransactionManager manager = new SpringTransactionManager(platformTransactionManager);

        assertThrows(IllegalStateException.class, () -> manager.withinTransaction(() -> {
            throw new IllegalStateException("boom");
        }));

        verify(platformTransactionManager).rollback(status);
        verify(platformTransactionManager, never()).commit(any());
    }

    @Test
    @DisplayName("should run work directly without a transaction in the no-op manager")
    void shouldRunDirectlyInNoopManager() {
        assertEquals(3, NoopTransactionManager.INSTANCE.withinTransaction(() -> 3));
    }
}
