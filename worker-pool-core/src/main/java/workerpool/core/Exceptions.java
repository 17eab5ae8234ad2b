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

import java.util.concurrent.RejectedExecutionException;

import org.jspecify.annotations.Nullable;

/**
 * Global factories and checks for the exceptions a {@link WorkerPool} produces.
 * <p>
 * Only {@link InvalidTaskException} and {@link PoolClosedException} (plus plain
 * {@link RejectedExecutionException} for interrupted or thread-less submissions) ever
 * reach callers. {@link #OVERLOAD} and {@link #CLOSED} are internal markers a worker
 * receives when it is not allowed to park again.
 */
public abstract class Exceptions {

	/**
	 * Marker returned to a worker that finished its task while the pool runs more workers
	 * than its (lowered) capacity. The worker retires instead of parking.
	 */
	public static final RejectedExecutionException OVERLOAD =
			new StaticRejectedExecutionException("Pool overload: more running workers than capacity");

	/**
	 * Marker returned to a worker that finished its task after the pool was closed.
	 */
	public static final RejectedExecutionException CLOSED =
			new StaticRejectedExecutionException("Pool has been closed");

	/**
	 * @return a new {@link InvalidTaskException} for a {@code null} task
	 */
	public static IllegalArgumentException failWithInvalidTask() {
		return new InvalidTaskException("Invalid task, must not be null");
	}

	/**
	 * @param poolName the name of the closed pool, used in the message
	 * @return a new {@link PoolClosedException}
	 */
	public static RejectedExecutionException failWithClosed(String poolName) {
		return new PoolClosedException("Pool " + poolName + " has been closed");
	}

	/**
	 * Return a new {@link RejectedExecutionException} with standard message and cause.
	 *
	 * @param cause the original exception that caused the rejection
	 * @return a new {@link RejectedExecutionException}
	 */
	public static RejectedExecutionException failWithRejected(Throwable cause) {
		return new RejectedExecutionException("Pool unable to accept the task", cause);
	}

	/**
	 * @param t the {@link Throwable} to check
	 * @return true if the error signals a submission to, or a park attempt in, a closed pool
	 */
	public static boolean isClosed(@Nullable Throwable t) {
		return t instanceof PoolClosedException || t == CLOSED;
	}

	public static boolean isInvalidTask(@Nullable Throwable t) {
		return t instanceof InvalidTaskException;
	}

	public static boolean isOverload(@Nullable Throwable t) {
		return t == OVERLOAD;
	}

	/**
	 * Throws a particular {@code Throwable} only if it belongs to a set of "fatal" error
	 * varieties native to the JVM: {@link VirtualMachineError} and {@link LinkageError}.
	 *
	 * @param t the exception to evaluate
	 */
	public static void throwIfJvmFatal(@Nullable Throwable t) {
		if (t instanceof VirtualMachineError) {
			throw (VirtualMachineError) t;
		}
		if (t instanceof LinkageError) {
			throw (LinkageError) t;
		}
	}

	Exceptions() {
	}

	/**
	 * Thrown by {@link WorkerPool#submit(Runnable)} when the task is {@code null}.
	 */
	public static final class InvalidTaskException extends IllegalArgumentException {

		InvalidTaskException(String message) {
			super(message);
		}
	}

	/**
	 * Thrown by {@link WorkerPool#submit(Runnable)} once the pool has been closed,
	 * including for submitters that were waiting for a worker when it happened.
	 */
	public static final class PoolClosedException extends RejectedExecutionException {

		PoolClosedException(String message) {
			super(message);
		}
	}

	/**
	 * A {@link RejectedExecutionException} that is tailored for usage as a static final
	 * field. It avoids {@link ClassLoader}-related leaks by bypassing stacktrace filling.
	 */
	static final class StaticRejectedExecutionException extends RejectedExecutionException {

		StaticRejectedExecutionException(String message) {
			super(message);
		}

		@Override
		public synchronized Throwable fillInStackTrace() {
			return this;
		}
	}
}
