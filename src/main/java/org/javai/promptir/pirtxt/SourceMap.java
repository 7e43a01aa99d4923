package org.javai.promptir.pirtxt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.promptir.ir.SourceSpan;
import org.javai.promptir.ir.SymbolKind;

/**
 * Spans of declarations and references recorded while parsing a module.
 * <p>
 * References are kept per name in encounter order, which matches the pre-order in which
 * {@link org.javai.promptir.ir.EmitOpWalker} visits a module's operations.
 */
public final class SourceMap {

	private static final SourceMap EMPTY = new SourceMap(Map.of(), Map.of());

	private final Map<String, SourceSpan> declarations;
	private final Map<String, List<SourceSpan>> references;

	private SourceMap(Map<String, SourceSpan> declarations, Map<String, List<SourceSpan>> references) {
		this.declarations = declarations;
		this.references = references;
	}

	public static SourceMap empty() {
		return EMPTY;
	}

	/**
	 * Span of the first declaration of {@code name} in the given namespace.
	 */
	public Optional<SourceSpan> declaration(SymbolKind kind, String name) {
		return Optional.ofNullable(declarations.get(key(kind, name)));
	}

	/**
	 * Span of the n-th reference to {@code name} in the given namespace.
	 */
	public Optional<SourceSpan> reference(SymbolKind kind, String name, int occurrence) {
		List<SourceSpan> spans = references.getOrDefault(key(kind, name), List.of());
		return occurrence >= 0 && occurrence < spans.size() ? Optional.of(spans.get(occurrence)) : Optional.empty();
	}

	public boolean isEmpty() {
		return declarations.isEmpty() && references.isEmpty();
	}

	private static String key(SymbolKind kind, String name) {
		return kind.name() + ":" + name;
	}

	static Builder builder() {
		return new Builder();
	}

	static final class Builder {
		private final Map<String, SourceSpan> declarations = new LinkedHashMap<>();
		private final Map<String, List<SourceSpan>> references = new LinkedHashMap<>();

		void declaration(SymbolKind kind, String name, SourceSpan span) {
			declarations.putIfAbsent(key(kind, name), span);
		}

		void reference(SymbolKind kind, String name, SourceSpan span) {
			references.computeIfAbsent(key(kind, name), k -> new ArrayList<>()).add(span);
		}

		SourceMap build() {
			Map<String, List<SourceSpan>> frozen = new LinkedHashMap<>();
			references.forEach((key, spans) -> frozen.put(key, List.copyOf(spans)));
			return new SourceMap(Collections.unmodifiableMap(new LinkedHashMap<>(declarations)),
					Collections.unmodifiableMap(frozen));
		}
	}
}
