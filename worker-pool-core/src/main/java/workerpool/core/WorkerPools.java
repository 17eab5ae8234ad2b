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

package workerpool.core;

import java.time.Duration;
import java.util.Optional;

/**
 * Factories for {@link WorkerPool} instances, and the defaults applied to unset
 * {@link PoolOptions}.
 * <p>
 * Every pool returned here is already started: its reaper is scheduled and the pool
 * accepts submissions until {@link WorkerPool#close() closed}.
 */
public abstract class WorkerPools {

	/**
	 * Default name of a pool, prefix of its thread names.
	 */
	public static final String DEFAULT_NAME = "workerpool";

	/**
	 * Default maximum number of live workers, initialized by system property
	 * {@code workerpool.defaultCapacity} and falls back to 100 000.
	 */
	public static final int DEFAULT_CAPACITY =
			Optional.ofNullable(System.getProperty("workerpool.defaultCapacity"))
			        .map(Integer::parseInt)
			        .filter(capacity -> capacity >= 0)
			        .orElse(100_000);

	/**
	 * Default idle time before a worker is reaped, initialized by system property
	 * {@code workerpool.defaultSurvivalTime} (in milliseconds) and falls back to 1 second.
	 */
	public static final Duration DEFAULT_SURVIVAL_TIME =
			Optional.ofNullable(System.getProperty("workerpool.defaultSurvivalTime"))
			        .map(Long::parseLong)
			        .filter(millis -> millis > 0)
			        .map(Duration::ofMillis)
			        .orElse(Duration.ofSeconds(1));

	/**
	 * Default minimum delay between two reaper sweeps, initialized by system property
	 * {@code workerpool.defaultMinCleanupInterval} (in milliseconds) and falls back to
	 * 1 second. Never lower than {@link PoolOptions#MIN_CLEANUP_INTERVAL_FLOOR}.
	 */
	public static final Duration DEFAULT_MIN_CLEANUP_INTERVAL =
			Optional.ofNullable(System.getProperty("workerpool.defaultMinCleanupInterval"))
			        .map(Long::parseLong)
			        .map(Duration::ofMillis)
			        .filter(interval -> interval.compareTo(PoolOptions.MIN_CLEANUP_INTERVAL_FLOOR) >= 0)
			        .orElse(Duration.ofSeconds(1));

	/**
	 * Create a {@link WorkerPool} with all the default options.
	 *
	 * @return a new started {@link WorkerPool}
	 */
	public static WorkerPool newPool() {
		return newPool(PoolOptions.builder().build());
	}

	/**
	 * @param name the pool name, prefix of its thread names
	 * @return a new started {@link WorkerPool}
	 */
	public static WorkerPool newPool(String name) {
		return newPool(PoolOptions.builder()
		                          .name(name)
		                          .build());
	}

	/**
	 * @param name the pool name, prefix of its thread names
	 * @param capacity the maximum number of live workers, negative for the default
	 * @return a new started {@link WorkerPool}
	 */
	public static WorkerPool newPool(String name, int capacity) {
		return newPool(PoolOptions.builder()
		                          .name(name)
		                          .capacity(capacity)
		                          .build());
	}

	/**
	 * @param name the pool name, prefix of its thread names
	 * @param capacity the maximum number of live workers, negative for the default
	 * @param survivalTime the idle duration after which a worker is reaped
	 * @return a new started {@link WorkerPool}
	 */
	public static WorkerPool newPool(String name, int capacity, Duration survivalTime) {
		return newPool(PoolOptions.builder()
		                          .name(name)
		                          .capacity(capacity)
		                          .survivalTime(survivalTime)
		                          .build());
	}

	/**
	 * @param options the pool configuration
	 * @return a new started {@link WorkerPool}
	 */
	public static WorkerPool newPool(PoolOptions options) {
		WorkerPool pool = new WorkerPool(options);
		pool.start();
		return pool;
	}

	WorkerPools() {
	}
}
