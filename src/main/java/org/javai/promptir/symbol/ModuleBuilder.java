package org.javai.promptir.symbol;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.promptir.ir.Declaration;
import org.javai.promptir.ir.InputDecl;
import org.javai.promptir.ir.Message;
import org.javai.promptir.ir.PirModule;
import org.javai.promptir.ir.RenderConfig;
import org.javai.promptir.ir.SectionDecl;
import org.javai.promptir.ir.SlotDecl;

/**
 * Construction API for modules.
 * <p>
 * Declarations go through a {@link SymbolTable}, so a duplicate name fails at the point it
 * is declared:
 *
 * <pre>
 * PirModule module = ModuleBuilder.module("support.triage")
 *         .version("v1.0")
 *         .input(InputDecl.of("ticket", ScalarKind.STRING, "user"))
 *         .section(SectionDecl.of("persona", "system", "You are a support agent."))
 *         .message(Message.of("system", EmitOp.section("persona")))
 *         .build();
 * </pre>
 */
public final class ModuleBuilder {

	private final String name;
	private final SymbolTable symbols;
	private final List<Declaration> declarations = new ArrayList<>();
	private final List<Message> messages = new ArrayList<>();
	private String version;
	private RenderConfig render;

	private ModuleBuilder(String name) {
		this.name = Objects.requireNonNull(name, "name must not be null");
		this.symbols = new SymbolTable(name);
	}

	public static ModuleBuilder module(String name) {
		return new ModuleBuilder(name);
	}

	public ModuleBuilder version(String version) {
		this.version = version;
		return this;
	}

	public ModuleBuilder input(InputDecl input) {
		declarations.add(symbols.declareInput(input));
		return this;
	}

	public ModuleBuilder section(SectionDecl section) {
		declarations.add(symbols.declareSection(section));
		return this;
	}

	public ModuleBuilder slot(SlotDecl slot) {
		declarations.add(symbols.declareSlot(slot));
		return this;
	}

	public ModuleBuilder message(Message message) {
		messages.add(Objects.requireNonNull(message, "message must not be null"));
		return this;
	}

	public ModuleBuilder render(RenderConfig render) {
		this.render = render;
		return this;
	}

	public PirModule build() {
		return new PirModule(name, version, declarations, messages, render);
	}
}
