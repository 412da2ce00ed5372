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

import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;

import static io.chainj.common.Checks.checkState;
import static java.util.Collections.emptyMap;

/**
 * Static settings of the application, looked up per class.
 * <p>
 * A setting {@code name} of class {@code type} is resolved in the following order:
 * <ol>
 *     <li>a value registered with {@link #set(Class, String, Object)}</li>
 *     <li>a property {@code <fully qualified class name>.<name>}</li>
 *     <li>a property {@code <simple class name>.<name>}</li>
 *     <li>a default value passed by the caller</li>
 * </ol>
 * Settings are usually read once into {@code static final} constants,
 * so all updates should happen before the first lookup.
 */
public final class ApplicationSettings {
	private static final Map<Class<?>, Map<String, Object>> customSettings = new HashMap<>();

	private static Properties properties = System.getProperties();
	private static volatile boolean firstLookupDone = false;

	private ApplicationSettings() {
	}

	/**
	 * Replaces system properties with given properties as a source of settings
	 */
	public static void useProperties(Properties properties) {
		ensureNotLookedUp();
		ApplicationSettings.properties = properties;
	}

	/**
	 * Registers a custom value of a setting, which takes precedence over properties
	 */
	public static void set(Class<?> type, String name, Object value) {
		ensureNotLookedUp();
		customSettings.computeIfAbsent(type, $ -> new HashMap<>()).put(name, value);
	}

	/**
	 * Retrieves a setting of a given class, parsing a property with a given parser
	 *
	 * @param parser   a function that parses a string property
	 * @param type     a class which owns a setting
	 * @param name     a name of a setting
	 * @param defValue a value used if a setting is not defined
	 * @param <T>      a type of setting
	 * @return a setting value
	 */
	public static <T> T get(Function<String, T> parser, Class<?> type, String name, T defValue) {
		checkState(!type.isAnonymousClass(), "Anonymous classes cannot be used for application settings");

		firstLookupDone = true;
		//noinspection unchecked
		T customSetting = (T) customSettings.getOrDefault(type, emptyMap()).get(name);
		if (customSetting != null) {
			return customSetting;
		}
		String property = getProperty(type, name);
		if (property != null) {
			return parser.apply(property.trim());
		}
		return defValue;
	}

	public static int getInt(Class<?> type, String name, int defValue) {
		return get(Integer::parseInt, type, name, defValue);
	}

	/**
	 * Retrieves a {@code long} setting, decimal or {@code 0x}-prefixed hexadecimal
	 */
	public static long getLong(Class<?> type, String name, long defValue) {
		return get(ApplicationSettings::parseLong, type, name, defValue);
	}

	public static boolean getBoolean(Class<?> type, String name, boolean defValue) {
		return get(s -> s.isEmpty() || Boolean.parseBoolean(s), type, name, defValue);
	}

	private static long parseLong(String s) {
		if (s.startsWith("0x") || s.startsWith("0X")) {
			return Long.parseUnsignedLong(s.substring(2), 16);
		}
		return Long.parseLong(s);
	}

	private static @Nullable String getProperty(Class<?> type, String name) {
		String property;
		property = properties.getProperty(type.getName() + "." + name);
		if (property != null) return property;
		property = properties.getProperty(type.getSimpleName() + "." + name);
		return property;
	}

	private static void ensureNotLookedUp() {
		if (firstLookupDone) {
			throw new IllegalStateException("Attempting to update application settings after some of them have been retrieved\n" +
					"All updates should happen prior to any constant initialization via ApplicationSettings, " +
					"preferably in static initialization block of 'main' class");
		}
	}
}
