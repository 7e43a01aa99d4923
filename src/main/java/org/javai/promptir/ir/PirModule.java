package org.javai.promptir.ir;

import java.util.List;
import java.util.Optional;

/**
 * Top-level unit of the prompt IR.
 * <p>
 * A module is a value: it is built once (by lowering, by parsing or through
 * {@code ModuleBuilder}) and never mutated. The {@code with*} methods return new modules.
 * Name uniqueness is checked by the symbol table rather than here, so that a parsed but
 * semantically invalid module can still be printed for inspection.
 *
 * @param name dotted qualified name
 * @param version version tag such as {@code v1.0}, may be null
 * @param declarations inputs, sections and slots in declaration order
 * @param messages messages in order
 * @param render render configuration, may be null
 */
public record PirModule(
		String name,
		String version,
		List<Declaration> declarations,
		List<Message> messages,
		RenderConfig render
) {

	public PirModule {
		Identifiers.require(name, "module name");
		if (version != null && !Identifiers.isVersion(version)) {
			throw new IllegalArgumentException("Invalid version tag '" + version + "': expected v<major>[.<minor>...]");
		}
		declarations = declarations == null ? List.of() : List.copyOf(declarations);
		messages = messages == null ? List.of() : List.copyOf(messages);
	}

	public List<InputDecl> inputs() {
		return declarations.stream()
				.filter(InputDecl.class::isInstance)
				.map(InputDecl.class::cast)
				.toList();
	}

	public List<SectionDecl> sections() {
		return declarations.stream()
				.filter(SectionDecl.class::isInstance)
				.map(SectionDecl.class::cast)
				.toList();
	}

	public List<SlotDecl> slots() {
		return declarations.stream()
				.filter(SlotDecl.class::isInstance)
				.map(SlotDecl.class::cast)
				.toList();
	}

	public Optional<RenderConfig> renderConfig() {
		return Optional.ofNullable(render);
	}

	public PirModule withDeclarations(List<Declaration> declarations) {
		return new PirModule(name, version, declarations, messages, render);
	}

	public PirModule withMessages(List<Message> messages) {
		return new PirModule(name, version, declarations, messages, render);
	}

	public PirModule withRender(RenderConfig render) {
		return new PirModule(name, version, declarations, messages, render);
	}

	public PirModule withVersion(String version) {
		return new PirModule(name, version, declarations, messages, render);
	}
}
