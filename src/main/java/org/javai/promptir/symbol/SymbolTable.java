package org.javai.promptir.symbol;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.promptir.ir.Declaration;
import org.javai.promptir.ir.InputDecl;
import org.javai.promptir.ir.PirModule;
import org.javai.promptir.ir.SectionDecl;
import org.javai.promptir.ir.SlotDecl;
import org.javai.promptir.ir.SymbolKind;

/**
 * Symbol table of a single module.
 * <p>
 * Inputs, sections and slots live in separate namespaces. The table is filled while a
 * module is constructed and only read afterwards; it never spans modules.
 */
public final class SymbolTable {

	private final String scope;
	private final Map<SymbolKind, Map<String, Declaration>> symbols = new EnumMap<>(SymbolKind.class);

	public SymbolTable(String scope) {
		this.scope = Objects.requireNonNull(scope, "scope must not be null");
		for (SymbolKind kind : SymbolKind.values()) {
			symbols.put(kind, new LinkedHashMap<>());
		}
	}

	/**
	 * Declares every declaration of a module, in declaration order.
	 *
	 * @throws DuplicateSymbolException on the first name declared twice in a namespace
	 */
	public static SymbolTable of(PirModule module) {
		SymbolTable table = new SymbolTable(module.name());
		module.declarations().forEach(table::declare);
		return table;
	}

	public InputDecl declareInput(InputDecl input) {
		declare(input);
		return input;
	}

	public SectionDecl declareSection(SectionDecl section) {
		declare(section);
		return section;
	}

	public SlotDecl declareSlot(SlotDecl slot) {
		declare(slot);
		return slot;
	}

	/**
	 * Declares any kind of declaration in its own namespace.
	 */
	public void declare(Declaration declaration) {
		Objects.requireNonNull(declaration, "declaration must not be null");
		Map<String, Declaration> namespace = symbols.get(declaration.symbolKind());
		if (namespace.containsKey(declaration.name())) {
			throw new DuplicateSymbolException(declaration.symbolKind(), declaration.name(), scope);
		}
		namespace.put(declaration.name(), declaration);
	}

	/**
	 * @throws UnknownSymbolException if no declaration of that kind has the name
	 */
	public Declaration resolve(SymbolKind kind, String name) {
		return find(kind, name).orElseThrow(() -> new UnknownSymbolException(kind, name, scope));
	}

	public InputDecl resolveInput(String name) {
		return (InputDecl) resolve(SymbolKind.INPUT, name);
	}

	public SectionDecl resolveSection(String name) {
		return (SectionDecl) resolve(SymbolKind.SECTION, name);
	}

	public SlotDecl resolveSlot(String name) {
		return (SlotDecl) resolve(SymbolKind.SLOT, name);
	}

	public Optional<Declaration> find(SymbolKind kind, String name) {
		return Optional.ofNullable(symbols.get(kind).get(name));
	}

	public boolean contains(SymbolKind kind, String name) {
		return symbols.get(kind).containsKey(name);
	}

	/**
	 * Names of one namespace in declaration order.
	 */
	public List<String> names(SymbolKind kind) {
		return List.copyOf(symbols.get(kind).keySet());
	}

	public Map<String, Declaration> namespace(SymbolKind kind) {
		return Collections.unmodifiableMap(symbols.get(kind));
	}

	public String scope() {
		return scope;
	}
}
