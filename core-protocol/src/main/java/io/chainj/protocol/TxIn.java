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
import java.util.Objects;

public record TxIn(OutPoint prevOut, byte[] scriptSig, long sequence) {
	public static final long SEQUENCE_FINAL = 0xFFFFFFFFL;

	public static TxIn create(OutPoint prevOut, byte[] scriptSig) {
		return new TxIn(prevOut, scriptSig, SEQUENCE_FINAL);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof TxIn that)) return false;
		return sequence == that.sequence &&
				prevOut.equals(that.prevOut) &&
				Arrays.equals(scriptSig, that.scriptSig);
	}

	@Override
	public int hashCode() {
		return 31 * Objects.hash(prevOut, sequence) + Arrays.hashCode(scriptSig);
	}

	@Override
	public String toString() {
		return "TxIn{prevOut=" + prevOut + ", scriptSig=" + scriptSig.length + " bytes, sequence=" + sequence + '}';
	}
}
