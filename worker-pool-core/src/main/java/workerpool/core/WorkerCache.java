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

import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Bounded free-list of terminated {@link Worker} shells, so that a burst following a
 * quiet period reuses identities and mailboxes instead of allocating them again. Shells
 * released while the cache is full are left to the garbage collector.
 */
final class WorkerCache {

	static final int DEFAULT_MAX_SIZE = 1024;

	final ConcurrentLinkedDeque<Worker> shells;
	final Supplier<Worker>              supplier;
	final AtomicInteger                 size;
	final int                           maxSize;

	WorkerCache(Supplier<Worker> supplier, int maxSize) {
		if (maxSize < 0) {
			throw new IllegalArgumentException("maxSize must be positive, was " + maxSize);
		}
		this.shells = new ConcurrentLinkedDeque<>();
		this.supplier = supplier;
		this.size = new AtomicInteger();
		this.maxSize = maxSize;
	}

	Worker acquire() {
		Worker w = shells.pollLast();
		if (w != null) {
			size.decrementAndGet();
			return w;
		}
		return supplier.get();
	}

	void release(Worker w) {
		w.reset();
		if (size.incrementAndGet() <= maxSize) {
			shells.addLast(w);
		}
		else {
			size.decrementAndGet();
		}
	}

	int size() {
		return size.get();
	}
}
