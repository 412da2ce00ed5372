/*
 * Copyright (C) 2020 ActiveJ LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.chainj.common;

import java.util.function.Supplier;

/**
 * This class is used for determining whether {@link Checks} should be enabled or not.
 * It is sometimes useful to disable preconditions checks at runtime environment
 * to squeeze out more performance in a tight loop.
 * <p>
 * The common pattern is having a
 * <pre>
 * {@code private static final boolean CHECKS = Checks.isEnabled(MyClass.class);}
 * </pre>
 * constant in your class. When using {@link Checks} just wrap the call in if-statement like so:
 * <pre>
 * {@code if (CHECKS) Checks.checkState(written == expected);}
 * </pre>
 * <p>
 * By default, all checks are <b>disabled</b> (like java asserts).
 * To enable all checks you can run application with system property {@code -Dchk=on}
 * You can enable or disable checks for the whole package (with its subpackages) or for individual classes
 * like so: {@code -Dchk:io.chainj.serializer=on -Dchk:io.chainj.bytebuf.ByteBuf=off}.
 * <p>
 * Argument checks that guard against reading or writing outside a buffer are not
 * wrapped in such an if-statement, they are always performed.
 */
public final class Checks {
	private static final boolean ENABLED_BY_DEFAULT;
	private static final String ENV_PREFIX = "chk:";

	static {
		String enabled = System.getProperty("chk");

		if (enabled == null || enabled.equals("off")) ENABLED_BY_DEFAULT = false;
		else if (enabled.equals("on")) ENABLED_BY_DEFAULT = true;
		else throw new RuntimeException(getErrorMessage(enabled));
	}

	private Checks() {
	}

	/**
	 * Indicates whether checks are enabled or disabled for the specified class
	 *
	 * @param cls class to be checked
	 * @return {@code true} if checks are enabled for the given class, {@code false} otherwise
	 */
	public static boolean isEnabled(Class<?> cls) {
		checkState(!cls.isAnonymousClass(), "Anonymous classes cannot be used for checks");

		String property;
		String path = cls.getName();
		if ((property = System.getProperty(ENV_PREFIX + path)) == null) {
			property = System.getProperty(ENV_PREFIX + cls.getSimpleName());
			while (property == null) {
				int idx = path.lastIndexOf('.');
				if (idx == -1) break;
				path = path.substring(0, idx);
				property = System.getProperty(ENV_PREFIX + path);
			}
		}

		boolean enabled = ENABLED_BY_DEFAULT;
		if (property != null) {
			if (property.equals("on")) enabled = true;
			else if (property.equals("off")) enabled = false;
			else throw new RuntimeException(getErrorMessage(property));
		}
		return enabled;
	}

	/**
	 * Checks a validity of a state
	 * <p>
	 * If a given expression is {@code true} then a method finishes successfully.
	 * Otherwise, an {@link IllegalStateException} is thrown with a specified message
	 *
	 * @param expression a boolean that represents a validity of a state
	 * @param message    an object that represents a message to be used in thrown {@link IllegalStateException}
	 * @throws IllegalStateException if a state is not valid
	 */
	public static void checkState(boolean expression, Object message) {
		if (!expression) {
			throw new IllegalStateException(String.valueOf(message));
		}
	}

	/**
	 * Checks a validity of a state
	 * <p>
	 * If a given expression is {@code true} then a method finishes successfully.
	 * Otherwise, an {@link IllegalStateException} is thrown with a supplied message
	 *
	 * @param expression a boolean that represents a validity of a state
	 * @param message    a supplier of message to be used in thrown {@link IllegalStateException}
	 * @throws IllegalStateException if a state is not valid
	 */
	public static void checkState(boolean expression, Supplier<String> message) {
		if (!expression) {
			throw new IllegalStateException(message.get());
		}
	}

	/**
	 * Checks a validity of an argument
	 * <p>
	 * If a given expression is {@code true} then a method finishes successfully.
	 * Otherwise, an {@link IllegalArgumentException} is thrown with a specified message
	 *
	 * @param expression a boolean that represents a validity of an argument
	 * @param message    an object that represents a message to be used in thrown {@link IllegalArgumentException}
	 * @throws IllegalArgumentException if an argument is not valid
	 */
	public static void checkArgument(boolean expression, Object message) {
		if (!expression) {
			throw new IllegalArgumentException(String.valueOf(message));
		}
	}

	/**
	 * Checks a validity of an argument
	 * <p>
	 * If a given expression is {@code true} then a method finishes successfully.
	 * Otherwise, an {@link IllegalArgumentException} is thrown with a supplied message
	 *
	 * @param expression a boolean that represents a validity of an argument
	 * @param message    a supplier of message to be used in thrown {@link IllegalArgumentException}
	 * @throws IllegalArgumentException if an argument is not valid
	 */
	public static void checkArgument(boolean expression, Supplier<String> message) {
		if (!expression) {
			throw new IllegalArgumentException(message.get());
		}
	}

	private static String getErrorMessage(String value) {
		return "Only 'on' and 'off' values are allowed for 'chk' system properties, was '" + value + '\'';
	}
}
