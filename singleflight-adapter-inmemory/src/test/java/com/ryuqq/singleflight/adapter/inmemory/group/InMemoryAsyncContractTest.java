package com.ryuqq.singleflight.adapter.inmemory.group;

import com.ryuqq.singleflight.application.group.FlightGroup;
import com.ryuqq.singleflight.testkit.contract.AsyncContractTest;

/**
 * {@link AsyncContractTest} against {@link InMemoryFlightGroup}.
 *
 * @author SingleFlight Team
 * @since 1.0.0
 */
class InMemoryAsyncContractTest extends AsyncContractTest {

    @Override
    protected FlightGroup<String> createGroup() {
        return new InMemoryFlightGroup<>(new FlightGroupConfig().withAsyncConcurrency(4));
    }

    @Override
    protected void disposeGroup(FlightGroup<String> group) throws Exception {
        ((InMemoryFlightGroup<String>) group).shutdown();
    }
}
