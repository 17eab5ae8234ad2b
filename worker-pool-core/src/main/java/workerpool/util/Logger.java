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

package workerpool.util;

/**
 * Logger interface used internally by the worker pool. Messages use the SLF4J
 * {@code {}} placeholder convention whatever the backing implementation.
 *
 * @see Loggers
 */
public interface Logger {

	/**
	 * Return the name of this {@link Logger} instance.
	 *
	 * @return name of this logger instance
	 */
	String getName();

	boolean isDebugEnabled();

	/**
	 * Log a message at the DEBUG level according to the specified format and arguments.
	 * The arguments array is allocated even when DEBUG is disabled, guard hot paths with
	 * {@link #isDebugEnabled()}.
	 *
	 * @param format the format string
	 * @param arguments the arguments substituted in place of {@code {}} placeholders
	 */
	void debug(String format, Object... arguments);

	/**
	 * Log an exception (throwable) at the WARN level with an accompanying message.
	 *
	 * @param msg the message accompanying the exception
	 * @param t the exception (throwable) to log
	 */
	void warn(String msg, Throwable t);

	/**
	 * Log an exception (throwable) at the ERROR level with an accompanying message.
	 *
	 * @param msg the message accompanying the exception
	 * @param t the exception (throwable) to log
	 */
	void error(String msg, Throwable t);
}
