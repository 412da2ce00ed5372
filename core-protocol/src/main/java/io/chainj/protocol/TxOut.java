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

import java.util.Arrays;

public record TxOut(long value, byte[] scriptPubKey) {

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof TxOut that)) return false;
		return value == that.value && Arrays.equals(scriptPubKey, that.scriptPubKey);
	}

	@Override
	public int hashCode() {
		return 31 * Long.hashCode(value) + Arrays.hashCode(scriptPubKey);
	}

	@Override
	public String toString() {
		return "TxOut{value=" + value + ", scriptPubKey=" + scriptPubKey.length + " bytes}";
	}
}
