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

import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.jspecify.annotations.Nullable;
import workerpool.util.Logger;
import workerpool.util.Loggers;

/**
 * Background task retiring the workers of a {@link WorkerPool} that stayed idle for at
 * least the survival time.
 * <p>
 * Each sweep walks the idle registry from its front and stops at the first worker that
 * is still young enough: workers are registered in park order, so everything behind it is
 * younger too. The next sweep is scheduled for when that worker expires, but never sooner
 * than the pool's minimum cleanup interval.
 */
final class Reaper implements Runnable {

	static final Logger LOGGER = Loggers.getLogger(Reaper.class);

	static final AtomicLong COUNTER = new AtomicLong();

	final WorkerPool parent;

	@Nullable
	volatile ScheduledExecutorService timer;

	Reaper(WorkerPool parent) {
		this.parent = parent;
	}

	void start() {
		if (timer != null) {
			return;
		}
		String threadName = parent.name + "-reaper-" + COUNTER.incrementAndGet();
		ThreadFactory factory = r -> {
			Thread t = new Thread(r, threadName);
			t.setDaemon(true);
			return t;
		};
		ScheduledExecutorService t = Executors.newSingleThreadScheduledExecutor(factory);
		this.timer = t;
		schedule(t, parent.survivalMillis);
	}

	@Override
	public void run() {
		long nextDelay = sweep(parent.clock.millis());
		ScheduledExecutorService t = timer;
		if (t != null) {
			schedule(t, nextDelay);
		}
	}

	/**
	 * Terminate every worker idle for at least the survival time at {@code now}.
	 *
	 * @param now the current time, in milliseconds
	 * @return the delay in milliseconds before the next sweep
	 */
	long sweep(long now) {
		long survival = parent.survivalMillis;
		long nextDelay = survival;
		int reaped = 0;
		parent.lock.lock();
		try {
			if (parent.closed) {
				return nextDelay;
			}
			Worker w;
			while ((w = parent.idle.peekFirst()) != null) {
				long idleFor = now - w.idleSince;
				if (idleFor < survival) {
					nextDelay = survival - idleFor;
					break;
				}
				parent.idle.pollFirst();
				w.terminate();
				reaped++;
			}
		}
		finally {
			parent.lock.unlock();
		}
		if (reaped > 0) {
			LOGGER.debug("Reaped {} idle workers of {}", reaped, parent.name);
		}
		return Math.max(nextDelay, parent.minCleanupIntervalMillis);
	}

	void schedule(ScheduledExecutorService t, long delayMillis) {
		try {
			t.schedule(this, delayMillis, TimeUnit.MILLISECONDS);
		}
		catch (RejectedExecutionException ree) {
			LOGGER.debug("Reaper of {} stopped, sweep not rescheduled", parent.name);
		}
	}

	/**
	 * Cancel the periodic sweep and terminate all the parked workers, whatever their age.
	 */
	void dispose() {
		ScheduledExecutorService t = timer;
		if (t != null) {
			t.shutdownNow();
		}
		int terminated = 0;
		parent.lock.lock();
		try {
			Worker w;
			while ((w = parent.idle.pollFirst()) != null) {
				w.terminate();
				terminated++;
			}
		}
		finally {
			parent.lock.unlock();
		}
		LOGGER.debug("Reaper of {} disposed, terminated {} idle workers", parent.name, terminated);
	}
}
