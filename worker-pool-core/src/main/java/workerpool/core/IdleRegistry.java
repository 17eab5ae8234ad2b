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

import org.jspecify.annotations.Nullable;

/**
 * Ordered registry of parked {@link Worker workers}, oldest first.
 * <p>
 * This is an intrusive doubly-linked list: the links live in the workers themselves so
 * that {@link #addLast(Worker)}, {@link #pollFirst()} and {@link #remove(Worker)} are all
 * O(1) and allocation-free. Since workers are appended when they park, the front is both
 * the next worker to hand a task to and the next candidate for reaping.
 * <p>
 * Not thread-safe, all access must happen under the owning pool's lock.
 */
final class IdleRegistry {

	@Nullable Worker head;
	@Nullable Worker tail;
	int              size;

	void addLast(Worker w) {
		if (w.linked) {
			throw new IllegalStateException(w + " is already parked");
		}
		Worker last = tail;
		w.previous = last;
		w.next = null;
		w.linked = true;
		if (last == null) {
			head = w;
		}
		else {
			last.next = w;
		}
		tail = w;
		size++;
	}

	@Nullable
	Worker peekFirst() {
		return head;
	}

	@Nullable
	Worker pollFirst() {
		Worker first = head;
		if (first != null) {
			unlink(first);
		}
		return first;
	}

	/**
	 * Remove the given worker if it is currently parked.
	 *
	 * @param w the worker to remove
	 * @return true if the worker was in the registry
	 */
	boolean remove(Worker w) {
		if (!w.linked) {
			return false;
		}
		unlink(w);
		return true;
	}

	int size() {
		return size;
	}

	boolean isEmpty() {
		return size == 0;
	}

	void unlink(Worker w) {
		Worker prev = w.previous;
		Worker next = w.next;
		if (prev == null) {
			head = next;
		}
		else {
			prev.next = next;
		}
		if (next == null) {
			tail = prev;
		}
		else {
			next.previous = prev;
		}
		w.previous = null;
		w.next = null;
		w.linked = false;
		size--;
	}
}
