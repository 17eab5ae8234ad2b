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

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

import workerpool.core.WorkerPool;

import static workerpool.core.observability.micrometer.PoolMeters.*;

/**
 * A {@link MeterBinder} exposing the state of a {@link WorkerPool}. The meters only hold a
 * weak reference to the pool and read it when polled, so binding adds no cost to task
 * submission or execution.
 *
 * @see PoolMeters
 */
public final class PoolMetrics implements MeterBinder {

	final WorkerPool pool;
	final Tags       tags;

	public PoolMetrics(WorkerPool pool) {
		this(pool, Tags.empty());
	}

	/**
	 * @param pool the pool to expose
	 * @param extraTags tags added to all the meters, on top of {@link PoolMeters.PoolTags#POOL_NAME}
	 */
	public PoolMetrics(WorkerPool pool, Iterable<Tag> extraTags) {
		this.pool = pool;
		this.tags = Tags.of(extraTags)
		                .and(PoolMeters.PoolTags.POOL_NAME.asString(), pool.name());
	}

	@Override
	public void bindTo(MeterRegistry registry) {
		Gauge.builder(WORKERS_RUNNING.getName(), pool, WorkerPool::running)
		     .description("Live workers of the pool, busy or idle")
		     .tags(tags)
		     .register(registry);
		Gauge.builder(WORKERS_IDLE.getName(), pool, WorkerPool::idle)
		     .description("Workers parked and waiting for a task")
		     .tags(tags)
		     .register(registry);
		Gauge.builder(CAPACITY.getName(), pool, WorkerPool::capacity)
		     .description("Maximum number of live workers")
		     .tags(tags)
		     .register(registry);
		Gauge.builder(FREE.getName(), pool, WorkerPool::free)
		     .description("Slots available for new workers")
		     .tags(tags)
		     .register(registry);

		FunctionCounter.builder(TASKS_COMPLETED.getName(), pool, WorkerPool::completedTasks)
		               .description("Tasks that returned normally")
		               .tags(tags)
		               .register(registry);
		FunctionCounter.builder(TASKS_FAILED.getName(), pool, WorkerPool::failedTasks)
		               .description("Tasks that threw")
		               .tags(tags)
		               .register(registry);
	}
}
