package org.javai.promptir.ir;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Closed set of values an optimizer hint can take.
 * <p>
 * Hints are opaque to the core; they are carried through parsing, printing, lowering and
 * lifting unchanged. Numbers keep their written scale so that {@code 1.50} prints back as
 * {@code 1.50}; a negative scale ({@code 1E+3}) is widened to zero, the form PIR-TXT can write.
 */
public sealed interface HintValue {

	record Str(String value) implements HintValue {
		public Str {
			Objects.requireNonNull(value, "value must not be null");
		}
	}

	record Num(BigDecimal value) implements HintValue {
		public Num {
			Objects.requireNonNull(value, "value must not be null");
			if (value.scale() < 0) {
				value = value.setScale(0);
			}
		}
	}

	record Bool(boolean value) implements HintValue {
	}

	/**
	 * Nested, insertion-ordered mapping.
	 */
	record Tree(Map<String, HintValue> entries) implements HintValue {
		public Tree {
			entries = ordered(entries);
		}
	}

	static HintValue of(String value) {
		return new Str(value);
	}

	static HintValue of(long value) {
		return new Num(BigDecimal.valueOf(value));
	}

	static HintValue of(boolean value) {
		return new Bool(value);
	}

	/**
	 * Copies a hint map into an unmodifiable map that keeps the source's iteration order.
	 */
	static Map<String, HintValue> ordered(Map<String, HintValue> hints) {
		if (hints == null || hints.isEmpty()) {
			return Map.of();
		}
		Map<String, HintValue> copy = new LinkedHashMap<>();
		hints.forEach((key, value) -> copy.put(
				Identifiers.require(key, "hint key"),
				Objects.requireNonNull(value, "hint value must not be null")));
		return Collections.unmodifiableMap(copy);
	}
}
