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

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

import org.jspecify.annotations.Nullable;

/**
 * A reusable execution context bound to one running-task slot of its {@link WorkerPool}.
 * <p>
 * A worker owns at most one thread at a time. It runs the task it was started with, then
 * asks the pool to park it and waits on its single-slot mailbox for the next task or for
 * the {@link #TERMINATE} sentinel. Once terminated, the shell (identity and mailbox) goes
 * back to the pool's {@link WorkerCache} and may be started again with a new thread.
 * <p>
 * {@link #state}, {@link #idleSince} and the registry links are guarded by the pool lock.
 */
final class Worker {

	static final int CREATED    = 0;
	static final int RUNNING    = 1;
	static final int IDLE       = 2;
	static final int TERMINATED = 3;

	/**
	 * Mailbox item telling a parked worker to terminate.
	 */
	static final Runnable TERMINATE = () -> { };

	static final AtomicLong ID_GENERATOR = new AtomicLong();

	final long                     id;
	final WorkerPool               parent;
	final BlockingQueue<Runnable>  mailbox;

	int  state = CREATED;
	long idleSince = -1L;

	@Nullable Worker  previous;
	@Nullable Worker  next;
	boolean           linked;

	Worker(WorkerPool parent) {
		this.id = ID_GENERATOR.incrementAndGet();
		this.parent = parent;
		this.mailbox = new ArrayBlockingQueue<>(1);
	}

	/**
	 * Start a new thread for this worker, running {@code firstTask} right away.
	 *
	 * @param firstTask the task that triggered the creation of this worker
	 */
	void start(Runnable firstTask) {
		Thread thread = parent.factory.newThread(() -> run(firstTask));
		if (thread == null) {
			throw new IllegalStateException("ThreadFactory of " + parent.name + " returned no thread");
		}
		thread.start();
	}

	/**
	 * Hand a task (or the {@link #TERMINATE} sentinel) to this worker. Only the party that
	 * removed the worker from the idle registry may deliver, so the mailbox is always empty.
	 *
	 * @param task the next item for this worker
	 */
	void deliver(Runnable task) {
		if (!mailbox.offer(task)) {
			throw new IllegalStateException("Worker " + id + " of " + parent.name + " already has a pending task");
		}
	}

	void terminate() {
		deliver(TERMINATE);
	}

	void run(Runnable firstTask) {
		Runnable task = firstTask;
		boolean retired = false;
		try {
			for (;;) {
				if (!runTask(task)) {
					break;
				}
				//don't let a task's interrupt abort the idle wait
				Thread.interrupted();
				RejectedExecutionException refused = parent.park(this);
				if (refused != null) {
					retired = true;
					break;
				}
				task = awaitNext();
				if (task == TERMINATE) {
					break;
				}
			}
		}
		finally {
			if (!retired) {
				parent.retire(this);
			}
		}
	}

	boolean runTask(Runnable task) {
		try {
			task.run();
			parent.onTaskCompleted();
			return true;
		}
		catch (Throwable t) {
			Exceptions.throwIfJvmFatal(t);
			parent.onTaskFailed(this, t);
			return false;
		}
	}

	Runnable awaitNext() {
		for (;;) {
			try {
				return mailbox.take();
			}
			catch (InterruptedException e) {
				if (parent.unpark(this)) {
					return TERMINATE;
				}
				//already claimed, the delivery is on its way
			}
		}
	}

	/**
	 * Clear per-run state before the shell is cached for reuse.
	 */
	void reset() {
		mailbox.clear();
		state = CREATED;
		idleSince = -1L;
		previous = null;
		next = null;
		linked = false;
	}

	@Override
	public String toString() {
		return parent.name + "-worker#" + id;
	}
}
