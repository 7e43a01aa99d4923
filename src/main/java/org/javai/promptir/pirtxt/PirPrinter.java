package org.javai.promptir.pirtxt;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.javai.promptir.config.PirSettings;
import org.javai.promptir.ir.Declaration;
import org.javai.promptir.ir.EmitOp;
import org.javai.promptir.ir.EmitOpVisitor;
import org.javai.promptir.ir.HintValue;
import org.javai.promptir.ir.InputDecl;
import org.javai.promptir.ir.Message;
import org.javai.promptir.ir.OutputField;
import org.javai.promptir.ir.PirModule;
import org.javai.promptir.ir.RenderConfig;
import org.javai.promptir.ir.SectionDecl;
import org.javai.promptir.ir.SlotDecl;
import org.javai.promptir.ir.SlotOption;
import org.javai.promptir.ir.SwitchCase;

/**
 * Prints modules in canonical PIR-TXT.
 * <p>
 * Output depends on the module only: declarations, messages and hint entries are printed in
 * their declaration order, attribute keys in a fixed order, flags only when set. Re-parsing
 * the output and printing again yields the same text.
 */
public class PirPrinter {

	private final String indentUnit;

	public PirPrinter() {
		this(PirSettings.defaults());
	}

	public PirPrinter(PirSettings settings) {
		this.indentUnit = settings.indent();
	}

	/**
	 * Static convenience method to print a module with the default settings.
	 */
	public static String print(PirModule module) {
		return new PirPrinter().printModule(module);
	}

	public String printModule(PirModule module) {
		StringBuilder out = new StringBuilder();
		out.append(PirParser.MODULE).append(" @").append(module.name());
		if (module.version() != null) {
			out.append(' ').append(module.version());
		}
		out.append(" {\n");
		for (Declaration declaration : module.declarations()) {
			out.append(indentUnit).append(printDeclaration(declaration)).append('\n');
		}
		for (Message message : module.messages()) {
			printMessage(message, out);
		}
		if (module.render() != null) {
			out.append(indentUnit).append(printRender(module.render())).append('\n');
		}
		out.append("}\n");
		return out.toString();
	}

	/**
	 * Prints a single declaration on one line, as it appears inside a module body.
	 */
	public String printDeclaration(Declaration declaration) {
		if (declaration instanceof InputDecl input) {
			return printInput(input);
		}
		if (declaration instanceof SectionDecl section) {
			return printSection(section);
		}
		return printSlot((SlotDecl) declaration);
	}

	private String printInput(InputDecl input) {
		List<String> attrs = new ArrayList<>();
		if (!input.values().isEmpty()) {
			attrs.add("values = " + input.values().stream().map(PirPrinter::quote)
					.collect(Collectors.joining(", ", "[", "]")));
		}
		if (input.channel() != null) {
			attrs.add("channel = " + quote(input.channel()));
		}
		if (input.required()) {
			attrs.add("required");
		}
		if (input.optimizable()) {
			attrs.add("optimizable");
		}
		if (!input.hints().isEmpty()) {
			attrs.add("hints = " + printHints(input.hints()));
		}
		String head = input.name() + " : " + input.kind().keyword();
		return attrs.isEmpty() ? head : head + " " + attributeList(attrs);
	}

	private String printSection(SectionDecl section) {
		List<String> attrs = new ArrayList<>();
		if (section.channel() != null) {
			attrs.add("channel = " + quote(section.channel()));
		}
		if (section.description() != null) {
			attrs.add("description = " + quote(section.description()));
		}
		attrs.add("text = " + quote(section.text()));
		if (section.optimizable()) {
			attrs.add("optimizable");
		}
		if (section.output() != null) {
			attrs.add("output = " + printOutput(section.output()));
		}
		return "@" + section.name() + " " + attributeList(attrs);
	}

	private String printOutput(OutputField output) {
		List<String> attrs = new ArrayList<>();
		attrs.add("key = " + quote(output.key()));
		attrs.add("kind = " + output.kind().keyword());
		if (output.required()) {
			attrs.add("required");
		}
		if (output.description() != null) {
			attrs.add("description = " + quote(output.description()));
		}
		return attributeList(attrs);
	}

	private String printSlot(SlotDecl slot) {
		List<String> attrs = new ArrayList<>();
		attrs.add("options = " + slot.options().stream()
				.map(this::printOption)
				.collect(Collectors.joining(", ", "[", "]")));
		if (slot.optimizable()) {
			attrs.add("optimizable");
		}
		if (!slot.hints().isEmpty()) {
			attrs.add("hints = " + printHints(slot.hints()));
		}
		return PirParser.SLOT + " " + slot.name() + " " + attributeList(attrs);
	}

	private String printOption(SlotOption option) {
		return attributeList(List.of("id = " + quote(option.id()), "text = " + quote(option.text())));
	}

	private String printRender(RenderConfig render) {
		List<String> attrs = new ArrayList<>();
		attrs.add("engine = " + quote(render.engine()));
		if (render.strict()) {
			attrs.add("strict");
		}
		return PirParser.RENDER + " " + attributeList(attrs);
	}

	private String printHints(Map<String, HintValue> hints) {
		List<String> entries = new ArrayList<>();
		hints.forEach((key, value) -> entries.add(key + " = " + printHint(value)));
		return attributeList(entries);
	}

	private String printHint(HintValue value) {
		if (value instanceof HintValue.Str str) {
			return quote(str.value());
		}
		if (value instanceof HintValue.Num num) {
			return num.value().toPlainString();
		}
		if (value instanceof HintValue.Bool bool) {
			return String.valueOf(bool.value());
		}
		return printHints(((HintValue.Tree) value).entries());
	}

	private void printMessage(Message message, StringBuilder out) {
		out.append(indentUnit).append(quote(message.channel())).append(' ');
		printBlock(message.ops(), 1, out);
		out.append('\n');
	}

	private void printBlock(List<EmitOp> ops, int depth, StringBuilder out) {
		if (ops.isEmpty()) {
			out.append("{}");
			return;
		}
		out.append("{\n");
		OpPrinter printer = new OpPrinter(depth + 1, out);
		for (EmitOp op : ops) {
			out.append(indentUnit.repeat(depth + 1));
			op.accept(printer);
			out.append('\n');
		}
		out.append(indentUnit.repeat(depth)).append('}');
	}

	/**
	 * Writes one operation, without leading indentation or trailing newline.
	 */
	private final class OpPrinter implements EmitOpVisitor<Void> {

		private final int depth;
		private final StringBuilder out;

		OpPrinter(int depth, StringBuilder out) {
			this.depth = depth;
			this.out = out;
		}

		@Override
		public Void visitLiteral(String text) {
			out.append(PirParser.OP_TEXT).append(' ').append(quote(text));
			return null;
		}

		@Override
		public Void visitSection(String name) {
			out.append(PirParser.OP_SECTION).append(' ').append(name);
			return null;
		}

		@Override
		public Void visitInput(String name) {
			out.append(PirParser.OP_INPUT).append(' ').append(name);
			return null;
		}

		@Override
		public Void visitSlot(String name) {
			out.append(PirParser.SLOT).append(' ').append(name);
			return null;
		}

		@Override
		public Void visitSwitch(EmitOp.Switch switchOp) {
			out.append(PirParser.SWITCH).append(' ').append(switchOp.input()).append(" {\n");
			for (SwitchCase switchCase : switchOp.cases()) {
				out.append(indentUnit.repeat(depth + 1))
						.append(PirParser.CASE).append(' ').append(quote(switchCase.value())).append(' ');
				printBlock(switchCase.ops(), depth + 1, out);
				out.append('\n');
			}
			if (switchOp.hasDefault()) {
				out.append(indentUnit.repeat(depth + 1)).append(PirParser.DEFAULT).append(' ');
				printBlock(switchOp.defaultOps(), depth + 1, out);
				out.append('\n');
			}
			out.append(indentUnit.repeat(depth)).append('}');
			return null;
		}
	}

	private static String attributeList(List<String> attrs) {
		return attrs.isEmpty() ? "{}" : "{ " + String.join(", ", attrs) + " }";
	}

	static String quote(String value) {
		StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			switch (c) {
				case '\\' -> sb.append("\\\\");
				case '"' -> sb.append("\\\"");
				case '\n' -> sb.append("\\n");
				case '\t' -> sb.append("\\t");
				case '\r' -> sb.append("\\r");
				default -> sb.append(c);
			}
		}
		return sb.append('"').toString();
	}
}
