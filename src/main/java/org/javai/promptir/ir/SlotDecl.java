package org.javai.promptir.ir;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A discrete choice point among fixed candidate wordings.
 */
public record SlotDecl(
		String name,
		List<SlotOption> options,
		boolean optimizable,
		Map<String, HintValue> hints
) implements Declaration {

	public SlotDecl {
		Identifiers.require(name, "slot name");
		options = options == null ? List.of() : List.copyOf(options);
		hints = HintValue.ordered(hints);
		if (options.isEmpty()) {
			throw new IllegalArgumentException("Slot '" + name + "' must declare at least one option");
		}
		Set<String> ids = new HashSet<>();
		for (SlotOption option : options) {
			if (!ids.add(option.id())) {
				throw new IllegalArgumentException("Slot '" + name + "' declares option '" + option.id() + "' more than once");
			}
		}
	}

	public static SlotDecl of(String name, List<SlotOption> options) {
		return new SlotDecl(name, options, false, Map.of());
	}

	public Optional<SlotOption> option(String id) {
		return options.stream().filter(option -> option.id().equals(id)).findFirst();
	}

	@Override
	public SymbolKind symbolKind() {
		return SymbolKind.SLOT;
	}
}
