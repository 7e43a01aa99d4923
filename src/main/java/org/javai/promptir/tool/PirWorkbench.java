package org.javai.promptir.tool;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.promptir.config.PirSettings;
import org.javai.promptir.ir.PirModule;
import org.javai.promptir.lint.Diagnostic;
import org.javai.promptir.lint.DiagnosticFormatter;
import org.javai.promptir.lint.LintEngine;
import org.javai.promptir.pirtxt.PirParser;
import org.javai.promptir.pirtxt.PirPrinter;
import org.javai.promptir.render.MustacheTemplateRenderer;
import org.javai.promptir.render.PromptRenderer;
import org.javai.promptir.render.RenderOptions;
import org.javai.promptir.render.RenderedMessage;

/**
 * Text-in, text-out operations for editors and command line tools.
 *
 * <pre>
 * PirWorkbench workbench = new PirWorkbench();
 * String canonical = workbench.format(source);
 * String report = workbench.lint(source);
 * </pre>
 */
public class PirWorkbench {

	private final PirParser parser;
	private final PirPrinter printer;
	private final LintEngine lintEngine;
	private final PromptRenderer renderer;

	public PirWorkbench() {
		this(PirSettings.defaults());
	}

	public PirWorkbench(PirSettings settings) {
		Objects.requireNonNull(settings, "settings must not be null");
		this.parser = new PirParser(settings);
		this.printer = new PirPrinter(settings);
		this.lintEngine = LintEngine.standard();
		this.renderer = new PromptRenderer(new MustacheTemplateRenderer(), settings);
	}

	/**
	 * Parses and prints canonically.
	 *
	 * @throws org.javai.promptir.pirtxt.PirSyntaxException if the text does not parse
	 */
	public String format(String text) {
		return printer.printModule(parser.parseModule(text));
	}

	public List<Diagnostic> diagnostics(String text) {
		return lintEngine.run(parser.parse(text));
	}

	/**
	 * Lints and formats the diagnostics one per line; empty when the module is clean.
	 */
	public String lint(String text) {
		return DiagnosticFormatter.format(diagnostics(text));
	}

	/**
	 * Diffs the canonical prints of two modules, so layout differences do not show.
	 */
	public String diff(String left, String right) {
		PirModule leftModule = parser.parseModule(left);
		PirModule rightModule = parser.parseModule(right);
		return LineDiff.unified(printer.printModule(leftModule), printer.printModule(rightModule),
				leftModule.name(), rightModule.name());
	}

	public List<RenderedMessage> render(String text, Map<String, Object> bindings, Map<String, String> slots,
			boolean enforceUnknownInputs) {
		return renderer.render(parser.parseModule(text), new RenderOptions(bindings, slots, enforceUnknownInputs));
	}
}
