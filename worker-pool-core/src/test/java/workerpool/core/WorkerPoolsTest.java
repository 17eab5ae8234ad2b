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
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import workerpool.test.AutoCloseExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class WorkerPoolsTest {

	@RegisterExtension
	AutoCloseExtension afterTest = new AutoCloseExtension();

	@Test
	void defaultsWithoutSystemProperties() {
		//only meaningful when the build doesn't set the properties
		if (System.getProperty("workerpool.defaultCapacity") == null) {
			assertThat(WorkerPools.DEFAULT_CAPACITY).isEqualTo(100_000);
		}
		if (System.getProperty("workerpool.defaultSurvivalTime") == null) {
			assertThat(WorkerPools.DEFAULT_SURVIVAL_TIME).isEqualTo(Duration.ofSeconds(1));
		}
		if (System.getProperty("workerpool.defaultMinCleanupInterval") == null) {
			assertThat(WorkerPools.DEFAULT_MIN_CLEANUP_INTERVAL).isEqualTo(Duration.ofSeconds(1));
		}
	}

	@Test
	void namedPool() {
		WorkerPool pool = afterTest.autoClose(WorkerPools.newPool("named"));

		assertThat(pool.name()).isEqualTo("named");
		assertThat(pool.capacity()).isEqualTo(WorkerPools.DEFAULT_CAPACITY);
	}

	@Test
	void namedPoolWithCapacity() {
		WorkerPool pool = afterTest.autoClose(WorkerPools.newPool("sized", 7));

		assertThat(pool.capacity()).isEqualTo(7);
		assertThat(pool.free()).isEqualTo(7);
	}

	@Test
	void negativeCapacityUsesDefault() {
		WorkerPool pool = afterTest.autoClose(WorkerPools.newPool("negative", -1));

		assertThat(pool.capacity()).isEqualTo(WorkerPools.DEFAULT_CAPACITY);
	}

	@Test
	void namedPoolWithCapacityAndSurvivalTime() {
		WorkerPool pool = afterTest.autoClose(WorkerPools.newPool("survival", 3, Duration.ofMillis(1500)));

		assertThat(pool.capacity()).isEqualTo(3);
		assertThat(pool.survivalMillis).isEqualTo(1500L);
		assertThat(pool.minCleanupIntervalMillis).isEqualTo(WorkerPools.DEFAULT_MIN_CLEANUP_INTERVAL.toMillis());
	}

	@Test
	void poolFromOptionsUsesFailureHandler() {
		AtomicInteger failures = new AtomicInteger();
		WorkerPool pool = afterTest.autoClose(WorkerPools.newPool(PoolOptions.builder()
		                                                                     .name("withHandler")
		                                                                     .failureHandler(failures::incrementAndGet)
		                                                                     .build()));

		pool.submit(() -> {
			throw new IllegalStateException("boom");
		});

		await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> assertThat(failures).hasValue(1));
	}

	@Test
	void poolIsStarted() {
		WorkerPool pool = afterTest.autoClose(WorkerPools.newPool("started"));

		assertThat(pool.reaper.timer).as("reaper scheduled").isNotNull();
	}
}
