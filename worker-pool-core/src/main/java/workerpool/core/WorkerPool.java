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
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import org.jspecify.annotations.Nullable;
import workerpool.util.Logger;
import workerpool.util.Loggers;

/**
 * A bounded pool of reusable workers, each running one task at a time on its own thread.
 * <p>
 * {@link #submit(Runnable)} hands the task to the oldest idle worker if there is one,
 * otherwise starts a new worker if fewer than {@link #capacity()} are alive, otherwise
 * blocks the caller until a worker parks or a slot frees up. Workers park after each task
 * and are retired by a background reaper once idle for longer than the survival time.
 * <p>
 * A task that throws never takes its worker thread down with it: the failure is counted,
 * reported to the {@link #setFailureHandler(Runnable) failure handler} and the worker
 * retires instead of parking. Nothing is reported to the submitter.
 * <p>
 * {@link #close()} stops accepting tasks, terminates idle workers and lets running ones
 * finish their task. {@link #closeGracefully()} additionally waits for them.
 *
 * @see WorkerPools
 */
public final class WorkerPool implements AutoCloseable {

	static final Logger LOGGER = Loggers.getLogger(WorkerPool.class);

	final String        name;
	final long          survivalMillis;
	final long          minCleanupIntervalMillis;
	final ThreadFactory factory;
	final Clock         clock;

	final ReentrantLock lock;
	final Condition     workerAvailable;
	final Condition     terminated;
	final IdleRegistry  idle;
	final WorkerCache   cache;
	final Reaper        reaper;

	final LongAdder completedTasks = new LongAdder();
	final LongAdder failedTasks    = new LongAdder();

	volatile int capacity;

	volatile int running;
	static final AtomicIntegerFieldUpdater<WorkerPool> RUNNING =
			AtomicIntegerFieldUpdater.newUpdater(WorkerPool.class, "running");

	// written under lock
	volatile boolean closed;

	@Nullable
	volatile Runnable failureHandler;

	WorkerPool(PoolOptions options) {
		this.name = options.name();
		this.capacity = options.capacity();
		this.survivalMillis = options.survivalTime().toMillis();
		this.minCleanupIntervalMillis = options.minCleanupInterval().toMillis();
		ThreadFactory threadFactory = options.threadFactory();
		this.factory = threadFactory != null
				? threadFactory
				: new WorkerThreadFactory(name, new AtomicLong(), options.daemon());
		this.clock = options.clock();
		this.failureHandler = options.failureHandler();

		this.lock = new ReentrantLock();
		this.workerAvailable = lock.newCondition();
		this.terminated = lock.newCondition();
		this.idle = new IdleRegistry();
		this.cache = new WorkerCache(() -> new Worker(this), WorkerCache.DEFAULT_MAX_SIZE);
		this.reaper = new Reaper(this);
	}

	/**
	 * Schedule the reaper. Called once by {@link WorkerPools}.
	 */
	void start() {
		reaper.start();
		LOGGER.debug("Started {}", this);
	}

	/**
	 * Run a task on a pooled worker, blocking the caller while the pool is saturated.
	 *
	 * @param task the task to run
	 * @throws Exceptions.InvalidTaskException if the task is {@code null}
	 * @throws Exceptions.PoolClosedException if the pool is closed, before or while waiting
	 * @throws RejectedExecutionException if interrupted while waiting for a worker, or if
	 * no thread could be created for a new worker
	 */
	public void submit(Runnable task) {
		if (task == null) {
			throw Exceptions.failWithInvalidTask();
		}
		if (closed) {
			throw Exceptions.failWithClosed(name);
		}

		Worker w;
		boolean fresh;
		lock.lock();
		try {
			w = claim();
			fresh = w.state == Worker.CREATED;
			w.state = Worker.RUNNING;
		}
		finally {
			lock.unlock();
		}

		if (fresh) {
			startWorker(w, task);
		}
		else {
			w.deliver(task);
		}
	}

	/**
	 * Run a task taking a single argument on a pooled worker.
	 *
	 * @param task the task to run
	 * @param arg the argument passed to the task
	 * @param <T> the type of the argument
	 * @see #submit(Runnable)
	 */
	public <T> void submit(Consumer<? super T> task, T arg) {
		if (task == null) {
			throw Exceptions.failWithInvalidTask();
		}
		submit(() -> task.accept(arg));
	}

	/**
	 * Find a worker for a submission: the oldest idle one, else a new one if a slot is
	 * free, else wait. Must be called under the lock.
	 */
	Worker claim() {
		for (;;) {
			if (closed) {
				throw Exceptions.failWithClosed(name);
			}
			Worker w = idle.pollFirst();
			if (w != null) {
				return w;
			}
			if (capacity - running > 0) {
				//reserve the slot before the thread exists so that racing submitters can't overshoot
				RUNNING.incrementAndGet(this);
				return cache.acquire();
			}
			try {
				workerAvailable.await();
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw Exceptions.failWithRejected(e);
			}
		}
	}

	void startWorker(Worker w, Runnable task) {
		try {
			w.start(task);
		}
		catch (Throwable e) {
			retire(w);
			Exceptions.throwIfJvmFatal(e);
			throw Exceptions.failWithRejected(e);
		}
	}

	/**
	 * Park a worker that just finished a task, unless the pool is closed or runs more
	 * workers than its capacity, in which case the worker is retired on the spot.
	 *
	 * @param w the worker that finished its task
	 * @return {@code null} if parked, {@link Exceptions#CLOSED} or
	 * {@link Exceptions#OVERLOAD} if retired
	 */
	@Nullable
	RejectedExecutionException park(Worker w) {
		lock.lock();
		try {
			if (closed) {
				retireLocked(w);
				return Exceptions.CLOSED;
			}
			if (capacity - running < 0) {
				LOGGER.debug("{} over capacity, retiring {}", this, w);
				retireLocked(w);
				return Exceptions.OVERLOAD;
			}
			w.idleSince = clock.millis();
			w.state = Worker.IDLE;
			idle.addLast(w);
			workerAvailable.signal();
			return null;
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Remove a parked worker from the idle registry, on behalf of the worker itself.
	 *
	 * @param w the worker to remove
	 * @return true if it was still parked, false if it has been claimed already
	 */
	boolean unpark(Worker w) {
		lock.lock();
		try {
			boolean removed = idle.remove(w);
			if (removed) {
				LOGGER.debug("{} interrupted while idle, retiring", w);
			}
			return removed;
		}
		finally {
			lock.unlock();
		}
	}

	void retire(Worker w) {
		lock.lock();
		try {
			retireLocked(w);
		}
		finally {
			lock.unlock();
		}
	}

	void retireLocked(Worker w) {
		w.state = Worker.TERMINATED;
		int remaining = RUNNING.decrementAndGet(this);
		workerAvailable.signal();
		if (remaining == 0) {
			terminated.signalAll();
		}
		cache.release(w);
	}

	void onTaskCompleted() {
		completedTasks.increment();
	}

	void onTaskFailed(Worker w, Throwable failure) {
		failedTasks.increment();
		Runnable handler = failureHandler;
		if (handler == null) {
			LOGGER.warn("Task failed on " + w + ", worker retires", failure);
			return;
		}
		LOGGER.debug("Task failed on {}, worker retires: {}", w, failure.toString());
		try {
			handler.run();
		}
		catch (Throwable e) {
			Exceptions.throwIfJvmFatal(e);
			LOGGER.error("Failure handler of " + name + " threw", e);
		}
	}

	/**
	 * Change the maximum number of live workers. Negative values and the current
	 * capacity are ignored. Lowering the capacity doesn't stop running workers, they
	 * retire as they finish their task until the pool is back under capacity.
	 *
	 * @param newCapacity the new capacity
	 */
	public void adjust(int newCapacity) {
		int previous = capacity;
		if (newCapacity < 0 || newCapacity == previous) {
			return;
		}
		capacity = newCapacity;
		LOGGER.debug("{} capacity adjusted from {} to {}", name, previous, newCapacity);
		if (newCapacity > previous) {
			lock.lock();
			try {
				workerAvailable.signalAll();
			}
			finally {
				lock.unlock();
			}
		}
	}

	/**
	 * Replace the callback invoked each time a task throws. The callback gets no context
	 * and is invoked on the worker thread; the failure itself is logged at DEBUG level.
	 * With no handler, failures are logged at WARN level.
	 *
	 * @param failureHandler the new handler, or {@code null} to remove it
	 */
	public void setFailureHandler(@Nullable Runnable failureHandler) {
		this.failureHandler = failureHandler;
	}

	/**
	 * @return the number of live workers, busy or idle
	 */
	public int running() {
		return running;
	}

	public int capacity() {
		return capacity;
	}

	/**
	 * @return {@code capacity() - running()}, negative while the pool is over a lowered capacity
	 */
	public int free() {
		return capacity - running;
	}

	/**
	 * @return the number of parked workers
	 */
	public int idle() {
		lock.lock();
		try {
			return idle.size();
		}
		finally {
			lock.unlock();
		}
	}

	public long completedTasks() {
		return completedTasks.sum();
	}

	public long failedTasks() {
		return failedTasks.sum();
	}

	public String name() {
		return name;
	}

	public boolean isClosed() {
		return closed;
	}

	/**
	 * @return true once the pool is closed and every worker has retired
	 */
	public boolean isTerminated() {
		return closed && running == 0;
	}

	/**
	 * Stop accepting tasks and terminate idle workers, without waiting for running ones.
	 * Submitters blocked on a saturated pool fail with {@link Exceptions.PoolClosedException}.
	 * Calling it again has no effect.
	 */
	@Override
	public void close() {
		shutdown();
	}

	/**
	 * {@link #close() Close} the pool and wait for every worker to retire. Must not be
	 * called from one of the pool's tasks, which would wait for itself.
	 *
	 * @throws InterruptedException if interrupted while waiting
	 */
	public void closeGracefully() throws InterruptedException {
		shutdown();
		lock.lock();
		try {
			while (running != 0) {
				terminated.await();
			}
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * {@link #close() Close} the pool and wait at most {@code timeout} for every worker
	 * to retire.
	 *
	 * @param timeout the maximum time to wait
	 * @return true if the pool terminated within the timeout
	 * @throws InterruptedException if interrupted while waiting
	 */
	public boolean closeGracefully(Duration timeout) throws InterruptedException {
		shutdown();
		long nanos = timeout.toNanos();
		lock.lock();
		try {
			while (running != 0) {
				if (nanos <= 0L) {
					return false;
				}
				nanos = terminated.awaitNanos(nanos);
			}
			return true;
		}
		finally {
			lock.unlock();
		}
	}

	void shutdown() {
		if (closed) {
			return;
		}
		lock.lock();
		try {
			if (closed) {
				return;
			}
			closed = true;
			workerAvailable.signalAll();
		}
		finally {
			lock.unlock();
		}
		reaper.dispose();
		LOGGER.debug("Closed {}", this);
	}

	@Override
	public String toString() {
		return "WorkerPool(\"" + name + "\",capacity=" + capacity + ",running=" + running + ",closed=" + closed + ")";
	}
}
