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

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

import workerpool.util.Logger;
import workerpool.util.Loggers;

/**
 * The default {@link ThreadFactory} of a {@link WorkerPool}, creating {@link Thread threads}
 * named after the pool and suffixed with a counter shared by all its workers.
 * <p>
 * Task failures never reach the threads' {@link Thread.UncaughtExceptionHandler}, only
 * JVM-fatal errors do, and these are logged before the thread dies.
 */
final class WorkerThreadFactory implements ThreadFactory,
                                           Thread.UncaughtExceptionHandler {

	static final Logger LOGGER = Loggers.getLogger(WorkerThreadFactory.class);

	final private String     name;
	final private AtomicLong counterReference;
	final private boolean    daemon;

	WorkerThreadFactory(String name, AtomicLong counterReference, boolean daemon) {
		this.name = name;
		this.counterReference = counterReference;
		this.daemon = daemon;
	}

	@Override
	public Thread newThread(Runnable runnable) {
		Thread t = new Thread(runnable, name + "-" + counterReference.incrementAndGet());
		t.setDaemon(daemon);
		t.setUncaughtExceptionHandler(this);
		return t;
	}

	@Override
	public void uncaughtException(Thread t, Throwable e) {
		LOGGER.error("Worker thread " + t.getName() + " died with a fatal error", e);
	}

	@Override
	public String toString() {
		return "WorkerThreadFactory(\"" + name + "\",daemon=" + daemon + ")";
	}
}
