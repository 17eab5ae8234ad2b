/*
 * Copyright (c) 2024 VMware Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package workerpool.core.observability.micrometer;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;

import workerpool.core.WorkerPool;

/**
 * Entry point to instrument {@link WorkerPool worker pools} with Micrometer.
 */
public final class Micrometer {

	/**
	 * Register the {@link PoolMeters} of a {@link WorkerPool} in the provided
	 * {@link MeterRegistry}, tagged with the pool name.
	 * See {@link PoolMeters} for a documentation of the meters.
	 *
	 * @param pool the pool to instrument
	 * @param meterRegistry the {@link MeterRegistry} in which to register the meters
	 * @return the same pool, for fluent usage
	 */
	public static WorkerPool bind(WorkerPool pool, MeterRegistry meterRegistry) {
		return bind(pool, meterRegistry, Tags.empty());
	}

	/**
	 * Register the {@link PoolMeters} of a {@link WorkerPool} in the provided
	 * {@link MeterRegistry}, with a user-provided collection of common tags added to the
	 * pool name tag. Note that some monitoring systems like Prometheus require to have the
	 * exact same set of tags for each meter bearing the same name.
	 *
	 * @param pool the pool to instrument
	 * @param meterRegistry the {@link MeterRegistry} in which to register the meters
	 * @param tags the tags to add to all the meters
	 * @return the same pool, for fluent usage
	 */
	public static WorkerPool bind(WorkerPool pool, MeterRegistry meterRegistry, Iterable<Tag> tags) {
		new PoolMetrics(pool, tags).bindTo(meterRegistry);
		return pool;
	}

	private Micrometer() {
	}
}
