package org.javai.promptir.render;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.javai.promptir.PirException;
import org.javai.promptir.config.PirSettings;
import org.javai.promptir.ir.EmitOp;
import org.javai.promptir.ir.EmitOpVisitor;
import org.javai.promptir.ir.Message;
import org.javai.promptir.ir.PirModule;
import org.javai.promptir.ir.RenderConfig;
import org.javai.promptir.ir.SectionDecl;
import org.javai.promptir.ir.SlotDecl;
import org.javai.promptir.ir.SlotOption;
import org.javai.promptir.ir.SwitchCase;
import org.javai.promptir.ir.SymbolKind;
import org.javai.promptir.spec.TemplateMarkers;
import org.javai.promptir.symbol.ModuleValidator;
import org.javai.promptir.symbol.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders every message of a module.
 * <p>
 * Section embeds, slot choices and switch branches are resolved here; input placeholders
 * are left to the {@link TemplateRenderer}, which runs once per message with the module's
 * strict flag.
 */
public class PromptRenderer {

	private static final Logger logger = LoggerFactory.getLogger(PromptRenderer.class);

	private final TemplateRenderer renderer;
	private final PirSettings settings;

	public PromptRenderer() {
		this(new MustacheTemplateRenderer(), PirSettings.defaults());
	}

	public PromptRenderer(TemplateRenderer renderer, PirSettings settings) {
		this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
	}

	/**
	 * @throws org.javai.promptir.symbol.UnknownSymbolException if the module references an undeclared name
	 * @throws TemplateException if a message cannot be rendered
	 */
	public List<RenderedMessage> render(PirModule module, RenderOptions options) {
		SymbolTable symbols = ModuleValidator.validate(module);
		RenderConfig config = module.renderConfig()
				.orElseGet(() -> new RenderConfig(settings.defaultEngine(), settings.defaultStrict()));
		if (!renderer.engine().equals(config.engine())) {
			throw new PirException("Module '" + module.name() + "' requires engine '" + config.engine()
					+ "' but the renderer is '" + renderer.engine() + "'");
		}
		if (options.enforceUnknownInputs()) {
			for (String key : options.bindings().keySet()) {
				if (!symbols.contains(SymbolKind.INPUT, key)) {
					throw new TemplateException(TemplateException.Kind.UNKNOWN_VARIABLE, key,
							"Binding '" + key + "' is not a declared input of module '" + module.name() + "'");
				}
			}
		}

		List<RenderedMessage> rendered = new ArrayList<>();
		for (Message message : module.messages()) {
			String template = expand(message.ops(), symbols, options, config.strict());
			if (options.enforceUnknownInputs()) {
				for (String name : TemplateMarkers.referencedInputs(template)) {
					if (!symbols.contains(SymbolKind.INPUT, name)) {
						throw new TemplateException(TemplateException.Kind.UNKNOWN_VARIABLE, name,
								"The " + message.channel() + " message of module '" + module.name()
										+ "' references undeclared input '" + name + "'");
					}
				}
			}
			rendered.add(new RenderedMessage(message.channel(),
					renderer.render(template, options.bindings(), config.strict())));
		}
		logger.debug("Rendered {} messages of module '{}' (strict={})", rendered.size(), module.name(), config.strict());
		return rendered;
	}

	private String expand(List<EmitOp> ops, SymbolTable symbols, RenderOptions options, boolean strict) {
		StringBuilder template = new StringBuilder();
		EmitOpVisitor<Void> expander = new EmitOpVisitor<>() {
			@Override
			public Void visitLiteral(String text) {
				template.append(text);
				return null;
			}

			@Override
			public Void visitSection(String name) {
				template.append(sectionText(name, symbols, new ArrayDeque<>()));
				return null;
			}

			@Override
			public Void visitInput(String name) {
				template.append(TemplateMarkers.inputPlaceholder(name));
				return null;
			}

			@Override
			public Void visitSlot(String name) {
				template.append(chooseOption(symbols.resolveSlot(name), options).text());
				return null;
			}

			@Override
			public Void visitSwitch(EmitOp.Switch switchOp) {
				List<EmitOp> branch = selectBranch(switchOp, options, strict);
				if (branch != null) {
					template.append(expand(branch, symbols, options, strict));
				}
				return null;
			}
		};
		ops.forEach(op -> op.accept(expander));
		return template.toString();
	}

	private String sectionText(String name, SymbolTable symbols, Deque<String> embedding) {
		if (embedding.contains(name)) {
			List<String> cycle = new ArrayList<>(embedding);
			Collections.reverse(cycle);
			cycle.add(name);
			throw new TemplateException(TemplateException.Kind.SECTION_CYCLE, name,
					"Section '" + name + "' embeds itself via " + String.join(" -> ", cycle));
		}
		SectionDecl section = symbols.find(SymbolKind.SECTION, name)
				.map(SectionDecl.class::cast)
				.orElseThrow(() -> new TemplateException(TemplateException.Kind.UNKNOWN_VARIABLE, name,
						"Section '" + embedding.peek() + "' embeds undeclared section '" + name + "'"));
		embedding.push(name);
		String text = TemplateMarkers.replaceSectionEmbeds(section.text(),
				embedded -> sectionText(embedded, symbols, embedding));
		embedding.pop();
		return text;
	}

	private static SlotOption chooseOption(SlotDecl slot, RenderOptions options) {
		String chosen = options.slotChoices().get(slot.name());
		if (chosen == null) {
			return slot.options().get(0);
		}
		return slot.option(chosen).orElseThrow(() -> new TemplateException(TemplateException.Kind.UNKNOWN_VARIABLE,
				slot.name(), "Slot '" + slot.name() + "' has no option '" + chosen + "'"));
	}

	private static List<EmitOp> selectBranch(EmitOp.Switch switchOp, RenderOptions options, boolean strict) {
		Object value = options.bindings().get(switchOp.input());
		if (value == null && strict) {
			throw new TemplateException(TemplateException.Kind.MISSING_VARIABLE, switchOp.input(),
					"No binding for switched input '" + switchOp.input() + "'");
		}
		if (value != null) {
			String selector = String.valueOf(value);
			for (SwitchCase switchCase : switchOp.cases()) {
				if (switchCase.value().equals(selector)) {
					return switchCase.ops();
				}
			}
		}
		return switchOp.defaultOps();
	}
}
