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

package workerpool.test;

import java.lang.reflect.Field;
import java.util.function.Function;

import org.jspecify.annotations.Nullable;
import workerpool.util.Logger;
import workerpool.util.Loggers;

/**
 * Eases tests interested in what the pool classes emit through their {@link Logger loggers}.
 * Loggers are kept in static fields, so {@link #useCurrentLoggersWithCapture()} must run
 * before the classes under test are loaded, which the launcher session listener ensures.
 */
public final class LoggerUtils {

	static @Nullable CapturingFactory currentCapturingFactory;

	private LoggerUtils() {
	}

	/**
	 * Sets a {@link Loggers#useCustomLoggers(Function) logger factory} returning loggers that
	 * use the original logging framework, but also the logger set via
	 * {@link #enableCaptureWith(Logger)}, irrespective of their name.
	 *
	 * @return a handle that re-installs the original factory when closed
	 */
	public static AutoCloseable useCurrentLoggersWithCapture() throws IllegalStateException {
		try {
			Field lfField = Loggers.class.getDeclaredField("LOGGER_FACTORY");
			lfField.setAccessible(true);
			Object originalFactoryInstance = lfField.get(Loggers.class);
			if (originalFactoryInstance instanceof CapturingFactory) {
				return (CapturingFactory) originalFactoryInstance;
			}
			@SuppressWarnings("unchecked")
			final Function<String, ? extends Logger> originalFactory =
					(Function<String, ? extends Logger>) originalFactoryInstance;
			CapturingFactory capturingFactory = new CapturingFactory(originalFactory);
			currentCapturingFactory = capturingFactory;
			Loggers.useCustomLoggers(capturingFactory);
			return capturingFactory;
		}
		catch (NoSuchFieldException | IllegalAccessException e) {
			throw new IllegalStateException("Could not install custom logger", e);
		}
	}

	/**
	 * Set the logger used for capturing.
	 *
	 * @param testLogger the {@link Logger} in which to copy logs
	 * @throws IllegalStateException if no capturing factory is installed or a previous
	 * logger has been set but not cleared via {@link #disableCapture()}
	 */
	public static void enableCaptureWith(Logger testLogger) {
		CapturingFactory f = currentCapturingFactory;
		if (f == null) {
			throw new IllegalStateException("LoggerUtils#useCurrentLoggersWithCapture() hasn't been called");
		}
		f.enableRedirection(testLogger);
	}

	/**
	 * Disable capturing, forgetting about the logger set via {@link #enableCaptureWith(Logger)}.
	 */
	public static void disableCapture() {
		CapturingFactory f = currentCapturingFactory;
		if (f == null) {
			throw new IllegalStateException("LoggerUtils#useCurrentLoggersWithCapture() hasn't been called");
		}
		f.disableRedirection();
	}

	static final class CapturingFactory implements Function<String, Logger>, AutoCloseable {

		final Function<String, ? extends Logger> originalFactory;

		volatile @Nullable Logger capturingLogger;

		CapturingFactory(Function<String, ? extends Logger> originalFactory) {
			this.originalFactory = originalFactory;
		}

		void disableRedirection() {
			this.capturingLogger = null;
		}

		void enableRedirection(Logger captureLogger) {
			if (this.capturingLogger != null) {
				throw new IllegalStateException("A logger was already set, maybe from a previous run. Don't forget to call disableCapture()");
			}
			this.capturingLogger = captureLogger;
		}

		@Override
		public Logger apply(String category) {
			return new DivertingLogger(originalFactory.apply(category), this);
		}

		@Override
		public void close() {
			if (LoggerUtils.currentCapturingFactory == this) {
				LoggerUtils.currentCapturingFactory = null;
			}
			Loggers.useCustomLoggers(originalFactory);
		}
	}

	/**
	 * A Logger that behaves like its {@link #delegate} but also logs to its parent
	 * {@link CapturingFactory} capturing logger if it is set.
	 */
	static final class DivertingLogger implements Logger {

		private final Logger           delegate;
		private final CapturingFactory parent;

		DivertingLogger(Logger delegate, CapturingFactory parent) {
			this.delegate = delegate;
			this.parent = parent;
		}

		@Override
		public String getName() {
			return delegate.getName();
		}

		@Override
		public boolean isDebugEnabled() {
			Logger logger = parent.capturingLogger;
			return delegate.isDebugEnabled() || (logger != null && logger.isDebugEnabled());
		}

		@Override
		public void debug(String format, Object... arguments) {
			Logger logger = parent.capturingLogger;
			if (logger != null) {
				logger.debug(format, arguments);
			}
			delegate.debug(format, arguments);
		}

		@Override
		public void warn(String msg, Throwable t) {
			Logger logger = parent.capturingLogger;
			if (logger != null) {
				logger.warn(msg, t);
			}
			delegate.warn(msg, t);
		}

		@Override
		public void error(String msg, Throwable t) {
			Logger logger = parent.capturingLogger;
			if (logger != null) {
				logger.error(msg, t);
			}
			delegate.error(msg, t);
		}
	}
}
