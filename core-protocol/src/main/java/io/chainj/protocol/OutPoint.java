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

package io.chainj.protocol;

/**
 * Reference to an output of a previous transaction
 */
public record OutPoint(Hash256 txId, long index) {
	public static final long NULL_INDEX = 0xFFFFFFFFL;

	public static final OutPoint NULL = new OutPoint(Hash256.ZERO, NULL_INDEX);

	public boolean isNull() {
		return txId.isZero() && index == NULL_INDEX;
	}
}
