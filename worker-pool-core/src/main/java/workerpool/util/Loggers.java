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

import java.util.function.Function;
import java.util.logging.Level;
import java.util.regex.Matcher;

/**
 * Expose static methods to get a {@link Logger}. If SLF4J is on the classpath it is
 * used, otherwise loggers fall back to {@link java.util.logging.Logger java.util.logging}.
 * <p>
 * Tests (or applications with their own logging abstraction) can install a custom factory
 * with {@link #useCustomLoggers(Function)}. Note that loggers are usually resolved once
 * per class and kept in static fields, so the factory should be installed early.
 */
public abstract class Loggers {

	private static volatile Function<String, ? extends Logger> LOGGER_FACTORY;

	static {
		resetLoggerFactory();
	}

	/**
	 * Activate the SLF4J based factory if SLF4J is available, the JDK one otherwise.
	 */
	public static void resetLoggerFactory() {
		try {
			useSl4jLoggers();
		}
		catch (Throwable t) {
			useJdkLoggers();
		}
	}

	/**
	 * Force the usage of SLF4J based {@link Logger Loggers}, throwing if SLF4J isn't on
	 * the classpath.
	 */
	public static void useSl4jLoggers() {
		Function<String, Logger> loggerFactory = new Slf4JLoggerFactory();
		LOGGER_FACTORY = loggerFactory;
		loggerFactory.apply(Loggers.class.getName()).debug("Using Slf4j logging framework");
	}

	/**
	 * Force the usage of {@link java.util.logging} based {@link Logger Loggers}.
	 */
	public static void useJdkLoggers() {
		Function<String, Logger> loggerFactory = name -> new JdkLogger(java.util.logging.Logger.getLogger(name));
		LOGGER_FACTORY = loggerFactory;
		loggerFactory.apply(Loggers.class.getName()).debug("Using JDK logging framework");
	}

	/**
	 * Use a custom type of {@link Logger} created through the provided {@link Function},
	 * which takes a logger name as input. The function must be thread-safe.
	 *
	 * @param loggerFactory the {@link Function} providing a (possibly cached) {@link Logger}
	 * given a name
	 */
	public static void useCustomLoggers(Function<String, ? extends Logger> loggerFactory) {
		LOGGER_FACTORY = loggerFactory;
		loggerFactory.apply(Loggers.class.getName()).debug("Using custom logging");
	}

	public static Logger getLogger(String name) {
		return LOGGER_FACTORY.apply(name);
	}

	public static Logger getLogger(Class<?> cls) {
		return LOGGER_FACTORY.apply(cls.getName());
	}

	static final class Slf4JLoggerFactory implements Function<String, Logger> {

		@Override
		public Logger apply(String name) {
			return new Slf4JLogger(org.slf4j.LoggerFactory.getLogger(name));
		}
	}

	static final class Slf4JLogger implements Logger {

		final org.slf4j.Logger logger;

		Slf4JLogger(org.slf4j.Logger logger) {
			this.logger = logger;
		}

		@Override
		public String getName() {
			return logger.getName();
		}

		@Override
		public boolean isDebugEnabled() {
			return logger.isDebugEnabled();
		}

		@Override
		public void debug(String format, Object... arguments) {
			logger.debug(format, arguments);
		}

		@Override
		public void warn(String msg, Throwable t) {
			logger.warn(msg, t);
		}

		@Override
		public void error(String msg, Throwable t) {
			logger.error(msg, t);
		}
	}

	/**
	 * Wrapper over a JDK logger, formatting {@code {}} placeholders itself.
	 */
	static final class JdkLogger implements Logger {

		final java.util.logging.Logger logger;

		JdkLogger(java.util.logging.Logger logger) {
			this.logger = logger;
		}

		@Override
		public String getName() {
			return logger.getName();
		}

		@Override
		public boolean isDebugEnabled() {
			return logger.isLoggable(Level.FINE);
		}

		@Override
		public void debug(String format, Object... arguments) {
			log(Level.FINE, format, arguments);
		}

		@Override
		public void warn(String msg, Throwable t) {
			logger.log(Level.WARNING, msg, t);
		}

		@Override
		public void error(String msg, Throwable t) {
			logger.log(Level.SEVERE, msg, t);
		}

		void log(Level level, String format, Object... arguments) {
			if (logger.isLoggable(level)) {
				logger.log(level, format(format, arguments));
			}
		}

		static String format(String from, Object... arguments) {
			String computed = from;
			for (Object argument : arguments) {
				computed = computed.replaceFirst("\\{\\}", Matcher.quoteReplacement(String.valueOf(argument)));
			}
			return computed;
		}
	}
}
