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

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;

import org.jspecify.annotations.Nullable;

/**
 * Immutable configuration of a {@link WorkerPool}, created through {@link #builder()}.
 * Unset options take the {@link WorkerPools} defaults.
 */
public final class PoolOptions {

	/**
	 * Lower bound applied to {@link Builder#minCleanupInterval(Duration)}, so that a tiny
	 * survival time doesn't make the reaper spin.
	 */
	public static final Duration MIN_CLEANUP_INTERVAL_FLOOR = Duration.ofMillis(100);

	/**
	 * @return a new {@link Builder} initialized with the {@link WorkerPools} defaults
	 */
	public static Builder builder() {
		return new Builder();
	}

	final String                  name;
	final int                     capacity;
	final Duration                survivalTime;
	final Duration                minCleanupInterval;
	final boolean                 daemon;
	@Nullable final ThreadFactory threadFactory;
	@Nullable final Runnable      failureHandler;
	final Clock                   clock;

	PoolOptions(Builder builder) {
		this.name = builder.name;
		this.capacity = builder.capacity;
		this.survivalTime = builder.survivalTime;
		this.minCleanupInterval = builder.minCleanupInterval;
		this.daemon = builder.daemon;
		this.threadFactory = builder.threadFactory;
		this.failureHandler = builder.failureHandler;
		this.clock = builder.clock;
	}

	public String name() {
		return name;
	}

	public int capacity() {
		return capacity;
	}

	public Duration survivalTime() {
		return survivalTime;
	}

	public Duration minCleanupInterval() {
		return minCleanupInterval;
	}

	public boolean daemon() {
		return daemon;
	}

	@Nullable
	public ThreadFactory threadFactory() {
		return threadFactory;
	}

	@Nullable
	public Runnable failureHandler() {
		return failureHandler;
	}

	Clock clock() {
		return clock;
	}

	@Override
	public String toString() {
		return "PoolOptions{name=" + name + ", capacity=" + capacity + ", survivalTime=" + survivalTime +
				", minCleanupInterval=" + minCleanupInterval + ", daemon=" + daemon + '}';
	}

	public static final class Builder {

		String                  name               = WorkerPools.DEFAULT_NAME;
		int                     capacity           = WorkerPools.DEFAULT_CAPACITY;
		Duration                survivalTime       = WorkerPools.DEFAULT_SURVIVAL_TIME;
		Duration                minCleanupInterval = WorkerPools.DEFAULT_MIN_CLEANUP_INTERVAL;
		boolean                 daemon             = true;
		@Nullable ThreadFactory threadFactory;
		@Nullable Runnable      failureHandler;
		Clock                   clock              = Clock.systemUTC();

		Builder() {
		}

		/**
		 * Set the name of the pool, used as a prefix for its threads and in logs.
		 *
		 * @param name the pool name
		 * @return this builder
		 */
		public Builder name(String name) {
			this.name = Objects.requireNonNull(name, "name");
			return this;
		}

		/**
		 * Set the maximum number of live workers. A negative value falls back to
		 * {@link WorkerPools#DEFAULT_CAPACITY}.
		 *
		 * @param capacity the maximum number of concurrently running workers
		 * @return this builder
		 */
		public Builder capacity(int capacity) {
			this.capacity = capacity < 0 ? WorkerPools.DEFAULT_CAPACITY : capacity;
			return this;
		}

		/**
		 * Set for how long a worker may stay idle before the reaper retires it
		 * (resolution: ms).
		 *
		 * @param survivalTime the idle duration after which a worker is reaped, at least 1ms
		 * @return this builder
		 */
		public Builder survivalTime(Duration survivalTime) {
			Objects.requireNonNull(survivalTime, "survivalTime");
			if (survivalTime.toMillis() <= 0) {
				throw new IllegalArgumentException("survivalTime must be at least 1ms, was " + survivalTime);
			}
			this.survivalTime = survivalTime;
			return this;
		}

		/**
		 * Set the minimum delay between two reaper sweeps. Values below
		 * {@link #MIN_CLEANUP_INTERVAL_FLOOR} are raised to it.
		 *
		 * @param minCleanupInterval the minimum delay between two sweeps
		 * @return this builder
		 */
		public Builder minCleanupInterval(Duration minCleanupInterval) {
			Objects.requireNonNull(minCleanupInterval, "minCleanupInterval");
			this.minCleanupInterval = minCleanupInterval.compareTo(MIN_CLEANUP_INTERVAL_FLOOR) < 0
					? MIN_CLEANUP_INTERVAL_FLOOR
					: minCleanupInterval;
			return this;
		}

		public Builder daemon(boolean daemon) {
			this.daemon = daemon;
			return this;
		}

		/**
		 * Use a custom {@link ThreadFactory} for worker threads, in which case
		 * {@link #daemon(boolean)} is ignored and thread naming is up to the factory.
		 *
		 * @param threadFactory the factory creating worker threads
		 * @return this builder
		 */
		public Builder threadFactory(ThreadFactory threadFactory) {
			this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
			return this;
		}

		/**
		 * @param failureHandler callback invoked each time a task throws
		 * @return this builder
		 * @see WorkerPool#setFailureHandler(Runnable)
		 */
		public Builder failureHandler(Runnable failureHandler) {
			this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler");
			return this;
		}

		/**
		 * Set the {@link Clock} used to timestamp parked workers, which can be useful for
		 * tests.
		 */
		Builder clock(Clock clock) {
			this.clock = Objects.requireNonNull(clock, "clock");
			return this;
		}

		public PoolOptions build() {
			return new PoolOptions(this);
		}
	}
}
