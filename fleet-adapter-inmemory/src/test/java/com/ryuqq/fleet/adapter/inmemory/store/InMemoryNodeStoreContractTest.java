package com.ryuqq.fleet.adapter.inmemory.store;

import com.ryuqq.fleet.core.spi.NodeStore;
import com.ryuqq.fleet.testkit.contract.AbstractNodeStoreContractTest;

/**
 * {@link InMemoryNodeStore}가 {@link NodeStore} 계약을 만족하는지 검증.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryNodeStoreContractTest extends AbstractNodeStoreContractTest {

    @Override
    protected NodeStore createStore() {
        return new InMemoryNodeStore();
    }
}
