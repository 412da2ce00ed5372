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

package io.chainj.common.exception;

import io.chainj.common.ApplicationSettings;
import org.jetbrains.annotations.NotNull;

/**
 * Base type of every failure reported by binary codecs.
 * <p>
 * Codec failures are expected on a hot path (a peer may send garbage at any time),
 * so stack traces are not captured unless {@code CodecException.withStackTrace} setting is enabled.
 */
public class CodecException extends Exception {
	public static final boolean WITH_STACK_TRACE = ApplicationSettings.getBoolean(CodecException.class, "withStackTrace", false);

	public CodecException(@NotNull String message) {
		super(message);
	}

	@Override
	public synchronized Throwable fillInStackTrace() {
		return WITH_STACK_TRACE ? super.fillInStackTrace() : this;
	}
}
