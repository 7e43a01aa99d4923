package org.javai.promptir.ir;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A placeholder fed at render time.
 *
 * @param name symbol name, unique among the module's inputs
 * @param kind scalar kind
 * @param values enumeration values, non-empty and unique for {@link ScalarKind#ENUM}, empty otherwise
 * @param channel free-form channel tag, may be null
 * @param required whether a binding must be supplied
 * @param optimizable whether optimizer passes may alter this input
 * @param hints opaque optimizer hints in declaration order
 */
public record InputDecl(
		String name,
		ScalarKind kind,
		List<String> values,
		String channel,
		boolean required,
		boolean optimizable,
		Map<String, HintValue> hints
) implements Declaration {

	public InputDecl {
		Identifiers.require(name, "input name");
		Objects.requireNonNull(kind, "kind must not be null");
		values = values == null ? List.of() : List.copyOf(values);
		hints = HintValue.ordered(hints);
		if (kind == ScalarKind.ENUM) {
			if (values.isEmpty()) {
				throw new IllegalArgumentException("Enumeration input '" + name + "' must declare at least one value");
			}
			Set<String> seen = new HashSet<>();
			for (String value : values) {
				if (!seen.add(value)) {
					throw new IllegalArgumentException(
							"Enumeration input '" + name + "' declares value '" + value + "' more than once");
				}
			}
		} else if (!values.isEmpty()) {
			throw new IllegalArgumentException("Input '" + name + "' of kind " + kind.keyword() + " cannot declare values");
		}
	}

	public static InputDecl of(String name, ScalarKind kind, String channel) {
		return new InputDecl(name, kind, List.of(), channel, false, false, Map.of());
	}

	public static InputDecl enumeration(String name, List<String> values, String channel) {
		return new InputDecl(name, ScalarKind.ENUM, values, channel, false, false, Map.of());
	}

	public InputDecl withRequired(boolean required) {
		return new InputDecl(name, kind, values, channel, required, optimizable, hints);
	}

	public InputDecl withOptimizable(boolean optimizable) {
		return new InputDecl(name, kind, values, channel, required, optimizable, hints);
	}

	public InputDecl withHints(Map<String, HintValue> hints) {
		return new InputDecl(name, kind, values, channel, required, optimizable, hints);
	}

	@Override
	public SymbolKind symbolKind() {
		return SymbolKind.INPUT;
	}
}
