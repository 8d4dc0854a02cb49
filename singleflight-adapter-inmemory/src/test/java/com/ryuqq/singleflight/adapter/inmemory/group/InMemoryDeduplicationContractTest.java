package com.ryuqq.singleflight.adapter.inmemory.group;

import com.ryuqq.singleflight.application.group.FlightGroup;
import com.ryuqq.singleflight.testkit.contract.DeduplicationContractTest;

/**
 * {@link DeduplicationContractTest} against {@link InMemoryFlightGroup}.
 *
 * @author SingleFlight Team
 * @since 1.0.0
 */
class InMemoryDeduplicationContractTest extends DeduplicationContractTest {

    @Override
    protected FlightGroup<String> createGroup() {
        return new InMemoryFlightGroup<>(new FlightGroupConfig().withAsyncConcurrency(4));
    }

    @Override
    protected void disposeGroup(FlightGroup<String> group) throws Exception {
        ((InMemoryFlightGroup<String>) group).shutdown();
    }
}
