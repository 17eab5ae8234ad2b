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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import workerpool.test.AutoCloseExtension;
import workerpool.test.VirtualClock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class ReaperTest {

	@RegisterExtension
	AutoCloseExtension afterTest = new AutoCloseExtension();

	VirtualClock clock;
	WorkerPool   pool;

	@BeforeEach
	void setUp() {
		clock = new VirtualClock();
		//not started: sweeps are driven by the test
		pool = new WorkerPool(PoolOptions.builder()
		                                 .name("reaperTest")
		                                 .survivalTime(Duration.ofSeconds(1))
		                                 .minCleanupInterval(Duration.ofMillis(100))
		                                 .clock(clock)
		                                 .build());
	}

	Worker parkNewWorker() {
		Worker w = new Worker(pool);
		WorkerPool.RUNNING.incrementAndGet(pool);
		w.state = Worker.RUNNING;
		assertThat(pool.park(w)).as("parked").isNull();
		return w;
	}

	@Test
	void parkRecordsIdleSince() {
		clock.advanceTimeBy(Duration.ofMillis(250));

		Worker w = parkNewWorker();

		assertThat(w.idleSince).isEqualTo(250L);
		assertThat(w.state).isEqualTo(Worker.IDLE);
		assertThat(pool.idle()).isOne();
	}

	@Test
	void sweepReapsOnlyExpiredWorkers() {
		Worker w1 = parkNewWorker();
		clock.advanceTimeBy(Duration.ofMillis(400));
		Worker w2 = parkNewWorker();

		assertThat(pool.reaper.sweep(900L)).as("none expired, next in 100ms").isEqualTo(100L);
		assertThat(pool.idle()).isEqualTo(2);

		assertThat(pool.reaper.sweep(1000L)).as("w2 expires in 400ms").isEqualTo(400L);
		assertThat(pool.idle()).isOne();
		assertThat(w1.mailbox.peek()).isSameAs(Worker.TERMINATE);
		assertThat(w2.mailbox).isEmpty();
		assertThat(pool.idle.peekFirst()).isSameAs(w2);

		assertThat(pool.reaper.sweep(1950L)).as("empty registry").isEqualTo(1000L);
		assertThat(pool.idle()).isZero();
		assertThat(w2.mailbox.peek()).isSameAs(Worker.TERMINATE);
	}

	@Test
	void nextSweepIsFlooredByMinCleanupInterval() {
		parkNewWorker();

		assertThat(pool.reaper.sweep(990L)).isEqualTo(100L);
		assertThat(pool.idle()).isOne();
	}

	@Test
	void workerIdleForExactlySurvivalTimeIsReaped() {
		parkNewWorker();

		pool.reaper.sweep(1000L);

		assertThat(pool.idle()).isZero();
	}

	@Test
	void disposeTerminatesAllParkedWorkersRegardlessOfAge() {
		Worker w1 = parkNewWorker();
		Worker w2 = parkNewWorker();

		pool.close();

		assertThat(pool.idle()).isZero();
		assertThat(w1.mailbox.peek()).isSameAs(Worker.TERMINATE);
		assertThat(w2.mailbox.peek()).isSameAs(Worker.TERMINATE);
	}

	@Test
	void sweepAfterCloseIsNoop() {
		pool.close();

		assertThat(pool.reaper.sweep(10_000L)).isEqualTo(1000L);
	}

	@Test
	void parkIsRefusedOnceClosed() {
		Worker w = new Worker(pool);
		WorkerPool.RUNNING.incrementAndGet(pool);
		pool.close();

		assertThat(pool.park(w)).isSameAs(Exceptions.CLOSED);
		assertThat(pool.running()).as("retired").isZero();
		assertThat(pool.idle()).isZero();
	}

	@Test
	void parkIsRefusedWhenOverCapacity() {
		pool.adjust(1);
		Worker w1 = new Worker(pool);
		Worker w2 = new Worker(pool);
		WorkerPool.RUNNING.addAndGet(pool, 2);

		assertThat(pool.park(w1)).isSameAs(Exceptions.OVERLOAD);
		assertThat(pool.running()).isOne();
		assertThat(pool.park(w2)).as("back at capacity").isNull();
		assertThat(pool.idle()).isOne();
	}

	@Test
	void startedPoolReapsIdleWorkers() {
		WorkerPool started = afterTest.autoClose(WorkerPools.newPool(PoolOptions.builder()
		                                                                         .name("reaperLive")
		                                                                         .survivalTime(Duration.ofMillis(200))
		                                                                         .minCleanupInterval(Duration.ofMillis(100))
		                                                                         .build()));
		started.submit(() -> { });
		await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> assertThat(started.idle()).isOne());

		await().atMost(3, TimeUnit.SECONDS).untilAsserted(() -> assertThat(started.running()).isZero());
		assertThat(started.idle()).isZero();
		assertThat(started.isClosed()).as("reaping doesn't close").isFalse();
	}
}
