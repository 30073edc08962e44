package com.ryuqq.monobuild.adapter.inmemory.cache;

import com.ryuqq.monobuild.core.operation.OperationId;
import com.ryuqq.monobuild.core.spi.IncrementalStateStore;
import com.ryuqq.monobuild.testkit.contract.AbstractIncrementalStateStoreContractTest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Test for InMemoryIncrementalStateStore adapter.
 *
 * @author Monobuild Team
 * @since 1.0.0
 * @see AbstractIncrementalStateStoreContractTest
 */
class InMemoryIncrementalStateStoreContractTest extends AbstractIncrementalStateStoreContractTest {

    @Override
    protected IncrementalStateStore createStateStore() {
        return new InMemoryIncrementalStateStore();
    }

    @Test
    void testClear_ForgetsAllOperations() {
        // Given
        InMemoryIncrementalStateStore store = new InMemoryIncrementalStateStore();
        store.recordSuccess(OperationId.of("app (_phase:build)"), "hash-1");
        store.recordSuccess(OperationId.of("lib (_phase:build)"), "hash-2");

        // When
        store.clear();

        // Then
        assertThat(store.size()).isZero();
        assertThat(store.lastSuccessfulCacheKey(OperationId.of("app (_phase:build)"))).isEmpty();
    }
}
