package com.ryuqq.fleet.adapter.inmemory.store;

import com.ryuqq.fleet.core.spi.DeploymentStore;
import com.ryuqq.fleet.testkit.contract.AbstractDeploymentStoreContractTest;

/**
 * {@link InMemoryDeploymentStore}가 {@link DeploymentStore} 계약을 만족하는지 검증.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryDeploymentStoreContractTest extends AbstractDeploymentStoreContractTest {

    @Override
    protected DeploymentStore createStore() {
        return new InMemoryDeploymentStore();
    }
}
