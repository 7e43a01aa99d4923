package org.javai.promptir.pirtxt;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.javai.promptir.config.PirSettings;
import org.javai.promptir.ir.Declaration;
import org.javai.promptir.ir.EmitOp;
import org.javai.promptir.ir.HintValue;
import org.javai.promptir.ir.InputDecl;
import org.javai.promptir.ir.Message;
import org.javai.promptir.ir.OutputField;
import org.javai.promptir.ir.PirModule;
import org.javai.promptir.ir.RenderConfig;
import org.javai.promptir.ir.ScalarKind;
import org.javai.promptir.ir.SectionDecl;
import org.javai.promptir.ir.SlotDecl;
import org.javai.promptir.ir.SlotOption;
import org.javai.promptir.ir.SourceSpan;
import org.javai.promptir.ir.SwitchCase;
import org.javai.promptir.ir.SymbolKind;
import org.javai.promptir.pirtxt.PirToken.TokenType;

/**
 * Recursive-descent parser for PIR-TXT.
 * <p>
 * The parser checks syntax and the format version only. It performs no symbol resolution,
 * so a module emitting an undeclared section parses fine and is reported later by
 * {@link org.javai.promptir.symbol.ModuleValidator}.
 *
 * <pre>
 * ParsedModule parsed = new PirParser().parse(text);
 * PirModule module = parsed.module();
 * </pre>
 */
public class PirParser {

	private static final Pattern VERSION = Pattern.compile("v(\\d+)(\\.\\d+)*");

	static final String MODULE = "module";
	static final String SLOT = "slot";
	static final String RENDER = "render";
	static final String SWITCH = "switch";
	static final String CASE = "case";
	static final String DEFAULT = "default";
	static final String OP_TEXT = "text";
	static final String OP_SECTION = "section";
	static final String OP_INPUT = "input";

	private static final Set<String> INPUT_KEYS = Set.of("values", "channel", "required", "optimizable", "hints");
	private static final Set<String> SECTION_KEYS = Set.of("channel", "description", "text", "optimizable", "output");
	private static final Set<String> OUTPUT_KEYS = Set.of("key", "kind", "required", "description");
	private static final Set<String> SLOT_KEYS = Set.of("options", "optimizable", "hints");
	private static final Set<String> OPTION_KEYS = Set.of("id", "text");
	private static final Set<String> RENDER_KEYS = Set.of("engine", "strict");

	private final PirSettings settings;

	public PirParser() {
		this(PirSettings.defaults());
	}

	public PirParser(PirSettings settings) {
		if (settings == null) {
			throw new IllegalArgumentException("Settings cannot be null");
		}
		this.settings = settings;
	}

	/**
	 * Parses a complete PIR-TXT document.
	 *
	 * @throws PirSyntaxException if the text is malformed
	 * @throws UnsupportedVersionException if the version tag names an unsupported major version
	 */
	public ParsedModule parse(String text) {
		List<PirToken> tokens = new PirTokenizer(text).tokenize();
		return new Parse(tokens).module();
	}

	/**
	 * Parses a document and drops the source spans.
	 */
	public PirModule parseModule(String text) {
		return parse(text).module();
	}

	private final class Parse {

		private final ParserState state;
		private final SourceMap.Builder spans = SourceMap.builder();

		Parse(List<PirToken> tokens) {
			this.state = new ParserState(tokens);
		}

		ParsedModule module() {
			state.expectIdentifier(MODULE);
			state.expect(TokenType.AT, "'@' before the module name");
			String name = state.expect(TokenType.IDENTIFIER, "qualified module name").value();

			String version = null;
			if (state.check(TokenType.IDENTIFIER)) {
				PirToken versionToken = state.advance();
				version = checkVersion(versionToken);
			}

			state.expect(TokenType.LBRACE, "'{' to open the module body");
			List<Declaration> declarations = new ArrayList<>();
			List<Message> messages = new ArrayList<>();
			RenderConfig render = null;

			while (!state.check(TokenType.RBRACE)) {
				PirToken token = state.peek();
				switch (token.type()) {
					case AT -> declarations.add(section());
					case STRING -> messages.add(message());
					case IDENTIFIER -> {
						if (state.checkNext(TokenType.COLON)) {
							declarations.add(input());
						} else if (token.isIdentifier(SLOT) && state.checkNext(TokenType.IDENTIFIER)) {
							declarations.add(slot());
						} else if (token.isIdentifier(RENDER) && state.checkNext(TokenType.LBRACE)) {
							if (render != null) {
								throw state.error("Duplicate render block", token, "at most one render block");
							}
							render = render();
						} else {
							throw state.error("Unexpected " + token, token, BODY_ITEM);
						}
					}
					default -> throw state.error("Unexpected " + token, token, BODY_ITEM + " or '}'");
				}
			}
			state.expect(TokenType.RBRACE, "'}' to close the module body");
			state.expect(TokenType.EOF, "end of input after the module");

			return new ParsedModule(new PirModule(name, version, declarations, messages, render), spans.build());
		}

		private String checkVersion(PirToken token) {
			Matcher matcher = VERSION.matcher(token.value());
			if (!matcher.matches()) {
				throw state.error("Malformed version tag " + token, token, "a version tag such as v1.0 or '{'");
			}
			int major;
			try {
				major = Integer.parseInt(matcher.group(1));
			} catch (NumberFormatException e) {
				throw new UnsupportedVersionException(token.value(), token.span());
			}
			if (!settings.supportsMajorVersion(major)) {
				throw new UnsupportedVersionException(token.value(), token.span());
			}
			return token.value();
		}

		private InputDecl input() {
			PirToken nameToken = state.expect(TokenType.IDENTIFIER, "input name");
			state.expect(TokenType.COLON, "':' after the input name");
			PirToken kindToken = state.expect(TokenType.IDENTIFIER, "input kind");
			ScalarKind kind = ScalarKind.fromKeyword(kindToken.value())
					.orElseThrow(() -> state.error("Unknown input kind " + kindToken, kindToken, KIND_NAMES));

			Attrs attrs = state.check(TokenType.LBRACE) ? attrs() : new Attrs(kindToken.span());
			attrs.allowOnly(INPUT_KEYS, "input '" + nameToken.value() + "'");

			List<String> values = attrs.has("values")
					? attrs.list("values").stream().map(v -> v.asString("enumeration value")).toList()
					: List.of();
			spans.declaration(SymbolKind.INPUT, nameToken.value(), nameToken.span());
			try {
				return new InputDecl(
						nameToken.value(),
						kind,
						values,
						attrs.optionalString("channel"),
						attrs.flag("required"),
						attrs.flag("optimizable"),
						attrs.hints("hints"));
			} catch (IllegalArgumentException e) {
				throw new PirSyntaxException(e.getMessage(), nameToken.span(), "a valid input declaration", nameToken.toString());
			}
		}

		private SectionDecl section() {
			state.expect(TokenType.AT, "'@' before the section name");
			PirToken nameToken = state.expect(TokenType.IDENTIFIER, "section name");
			Attrs attrs = attrs();
			attrs.allowOnly(SECTION_KEYS, "section '" + nameToken.value() + "'");

			OutputField output = null;
			if (attrs.has("output")) {
				Attrs outputAttrs = attrs.map("output");
				outputAttrs.allowOnly(OUTPUT_KEYS, "output of section '" + nameToken.value() + "'");
				Value kindValue = outputAttrs.require("kind");
				String kindName = kindValue.asIdentifier("output kind");
				ScalarKind kind = ScalarKind.fromKeyword(kindName)
						.orElseThrow(() -> new PirSyntaxException("Unknown output kind '" + kindName + "'",
								kindValue.span(), KIND_NAMES, kindName));
				output = new OutputField(
						outputAttrs.require("key").asString("output key"),
						kind,
						outputAttrs.flag("required"),
						outputAttrs.optionalString("description"));
			}
			spans.declaration(SymbolKind.SECTION, nameToken.value(), nameToken.span());
			try {
				return new SectionDecl(
						nameToken.value(),
						attrs.optionalString("channel"),
						attrs.has("text") ? attrs.require("text").asString("section text") : "",
						attrs.flag("optimizable"),
						attrs.optionalString("description"),
						output);
			} catch (IllegalArgumentException e) {
				throw new PirSyntaxException(e.getMessage(), nameToken.span(), "a valid section declaration", nameToken.toString());
			}
		}

		private SlotDecl slot() {
			state.expectIdentifier(SLOT);
			PirToken nameToken = state.expect(TokenType.IDENTIFIER, "slot name");
			Attrs attrs = attrs();
			attrs.allowOnly(SLOT_KEYS, "slot '" + nameToken.value() + "'");

			List<SlotOption> options = new ArrayList<>();
			if (attrs.has("options")) {
				for (Value value : attrs.list("options")) {
					Attrs option = value.asMap("slot option");
					option.allowOnly(OPTION_KEYS, "option of slot '" + nameToken.value() + "'");
					options.add(new SlotOption(
							option.require("id").asString("option id"),
							option.has("text") ? option.require("text").asString("option text") : ""));
				}
			}
			spans.declaration(SymbolKind.SLOT, nameToken.value(), nameToken.span());
			try {
				return new SlotDecl(nameToken.value(), options, attrs.flag("optimizable"), attrs.hints("hints"));
			} catch (IllegalArgumentException e) {
				throw new PirSyntaxException(e.getMessage(), nameToken.span(), "a valid slot declaration", nameToken.toString());
			}
		}

		private RenderConfig render() {
			PirToken renderToken = state.expectIdentifier(RENDER);
			Attrs attrs = attrs();
			attrs.allowOnly(RENDER_KEYS, "render block");
			if (!attrs.has("engine")) {
				throw state.error("Render block requires an engine", renderToken, "engine = \"...\"");
			}
			return new RenderConfig(attrs.require("engine").asString("engine"), attrs.flag("strict"));
		}

		private Message message() {
			String channel = state.expect(TokenType.STRING, "message channel").value();
			return new Message(channel, block("message"));
		}

		private List<EmitOp> block(String owner) {
			state.expect(TokenType.LBRACE, "'{' to open the " + owner);
			List<EmitOp> ops = new ArrayList<>();
			while (!state.check(TokenType.RBRACE)) {
				ops.add(op());
			}
			state.expect(TokenType.RBRACE, "'}' to close the " + owner);
			return ops;
		}

		private EmitOp op() {
			PirToken keyword = state.expect(TokenType.IDENTIFIER, OPERATION);
			switch (keyword.value()) {
				case OP_TEXT:
					return EmitOp.literal(state.expect(TokenType.STRING, "literal text").value());
				case OP_SECTION:
					return EmitOp.section(reference(SymbolKind.SECTION, "section name"));
				case OP_INPUT:
					return EmitOp.input(reference(SymbolKind.INPUT, "input name"));
				case SLOT:
					return EmitOp.slot(reference(SymbolKind.SLOT, "slot name"));
				case SWITCH:
					return switchOp();
				default:
					throw state.error("Unknown operation " + keyword, keyword, OPERATION);
			}
		}

		private EmitOp switchOp() {
			String input = reference(SymbolKind.INPUT, "switched input name");
			state.expect(TokenType.LBRACE, "'{' to open the switch");
			List<SwitchCase> cases = new ArrayList<>();
			List<EmitOp> defaultOps = null;
			while (!state.check(TokenType.RBRACE)) {
				PirToken token = state.expect(TokenType.IDENTIFIER, "'case', 'default' or '}'");
				if (token.isIdentifier(CASE)) {
					if (defaultOps != null) {
						throw state.error("Case after default branch", token, "'}' after the default branch");
					}
					String value = state.expect(TokenType.STRING, "case value").value();
					cases.add(new SwitchCase(value, block("case")));
				} else if (token.isIdentifier(DEFAULT)) {
					if (defaultOps != null) {
						throw state.error("Duplicate default branch", token, "a single default branch");
					}
					defaultOps = block("default branch");
				} else {
					throw state.error("Unexpected " + token, token, "'case', 'default' or '}'");
				}
			}
			state.expect(TokenType.RBRACE, "'}' to close the switch");
			return new EmitOp.Switch(input, cases, defaultOps);
		}

		private String reference(SymbolKind kind, String description) {
			PirToken token = state.expect(TokenType.IDENTIFIER, description);
			spans.reference(kind, token.value(), token.span());
			return token.value();
		}

		private Attrs attrs() {
			PirToken open = state.expect(TokenType.LBRACE, "'{' to open an attribute list");
			Attrs attrs = new Attrs(open.span());
			while (!state.check(TokenType.RBRACE)) {
				if (state.check(TokenType.COMMA)) {
					state.advance();
					continue;
				}
				PirToken key = state.expect(TokenType.IDENTIFIER, "attribute name or '}'");
				Value value;
				if (state.check(TokenType.EQUALS)) {
					state.advance();
					value = value();
				} else {
					value = new Value.Flag(true, key.span());
				}
				if (attrs.entries.containsKey(key.value())) {
					throw state.error("Duplicate attribute '" + key.value() + "'", key, "each attribute at most once");
				}
				attrs.entries.put(key.value(), new Attr(key, value));
			}
			state.expect(TokenType.RBRACE, "'}' to close an attribute list");
			return attrs;
		}

		private Value value() {
			PirToken token = state.peek();
			switch (token.type()) {
				case STRING:
					state.advance();
					return new Value.Text(token.value(), token.span());
				case NUMBER:
					state.advance();
					return new Value.Number(token.value(), token.span());
				case IDENTIFIER:
					state.advance();
					if (token.isIdentifier("true") || token.isIdentifier("false")) {
						return new Value.Flag(Boolean.parseBoolean(token.value()), token.span());
					}
					return new Value.Ident(token.value(), token.span());
				case LBRACKET:
					return list();
				case LBRACE:
					return new Value.Mapping(attrs(), token.span());
				default:
					throw state.error("Unexpected " + token, token, "a value");
			}
		}

		private Value list() {
			PirToken open = state.expect(TokenType.LBRACKET, "'['");
			List<Value> items = new ArrayList<>();
			while (!state.check(TokenType.RBRACKET)) {
				if (state.check(TokenType.COMMA)) {
					state.advance();
					continue;
				}
				items.add(value());
			}
			state.expect(TokenType.RBRACKET, "']' to close a list");
			return new Value.Sequence(items, open.span());
		}
	}

	private static final String BODY_ITEM = "an input, section, slot, message or render block";
	private static final String OPERATION = "an operation (text, section, input, slot, switch)";
	private static final String KIND_NAMES = "one of " + Arrays.stream(ScalarKind.values())
			.map(ScalarKind::keyword)
			.collect(Collectors.joining(", "));

	private record Attr(PirToken key, Value value) {
	}

	/**
	 * Attribute list in source order.
	 */
	private static final class Attrs {

		private final SourceSpan span;
		private final Map<String, Attr> entries = new LinkedHashMap<>();

		Attrs(SourceSpan span) {
			this.span = span;
		}

		void allowOnly(Set<String> keys, String owner) {
			for (Attr attr : entries.values()) {
				if (!keys.contains(attr.key().value())) {
					throw new PirSyntaxException("Unknown attribute '" + attr.key().value() + "' on " + owner,
							attr.key().span(), "one of " + keys.stream().sorted().toList(), attr.key().toString());
				}
			}
		}

		boolean has(String key) {
			return entries.containsKey(key);
		}

		Value require(String key) {
			Attr attr = entries.get(key);
			if (attr == null) {
				throw new PirSyntaxException("Missing attribute '" + key + "'", span, "attribute '" + key + "'", "'}'");
			}
			return attr.value();
		}

		boolean flag(String key) {
			Attr attr = entries.get(key);
			return attr != null && attr.value().asFlag(key);
		}

		String optionalString(String key) {
			Attr attr = entries.get(key);
			return attr == null ? null : attr.value().asString(key);
		}

		List<Value> list(String key) {
			return require(key).asList(key);
		}

		Attrs map(String key) {
			return require(key).asMap(key);
		}

		Map<String, HintValue> hints(String key) {
			return has(key) ? map(key).toHints() : Map.of();
		}

		Map<String, HintValue> toHints() {
			Map<String, HintValue> hints = new LinkedHashMap<>();
			entries.forEach((name, attr) -> hints.put(name, attr.value().asHint(name)));
			return hints;
		}
	}

	/**
	 * Attribute value before it is interpreted by its owner.
	 */
	private sealed interface Value {

		SourceSpan span();

		default String describe() {
			return getClass().getSimpleName().toLowerCase();
		}

		private PirSyntaxException mismatch(String what, String expected) {
			return new PirSyntaxException("Unexpected " + describe() + " for " + what, span(), expected, describe());
		}

		default String asString(String what) {
			throw mismatch(what, "a string");
		}

		default String asIdentifier(String what) {
			throw mismatch(what, "an identifier");
		}

		default boolean asFlag(String what) {
			throw mismatch(what, "true, false or a bare flag");
		}

		default List<Value> asList(String what) {
			throw mismatch(what, "a list");
		}

		default Attrs asMap(String what) {
			throw mismatch(what, "an attribute mapping");
		}

		default HintValue asHint(String what) {
			throw mismatch(what, "a string, number, boolean or mapping");
		}

		record Text(String text, SourceSpan span) implements Value {
			@Override
			public String asString(String what) {
				return text;
			}

			@Override
			public HintValue asHint(String what) {
				return new HintValue.Str(text);
			}
		}

		record Number(String text, SourceSpan span) implements Value {
			@Override
			public HintValue asHint(String what) {
				return new HintValue.Num(new BigDecimal(text));
			}
		}

		record Flag(boolean value, SourceSpan span) implements Value {
			@Override
			public boolean asFlag(String what) {
				return value;
			}

			@Override
			public HintValue asHint(String what) {
				return new HintValue.Bool(value);
			}
		}

		record Ident(String name, SourceSpan span) implements Value {
			@Override
			public String asIdentifier(String what) {
				return name;
			}
		}

		record Sequence(List<Value> items, SourceSpan span) implements Value {
			@Override
			public List<Value> asList(String what) {
				return items;
			}
		}

		record Mapping(Attrs attrs, SourceSpan span) implements Value {
			@Override
			public Attrs asMap(String what) {
				return attrs;
			}

			@Override
			public HintValue asHint(String what) {
				return new HintValue.Tree(attrs.toHints());
			}
		}
	}

	/**
	 * Cursor over the token list.
	 */
	static final class ParserState {

		private final List<PirToken> tokens;
		private int current = 0;

		ParserState(List<PirToken> tokens) {
			this.tokens = tokens;
		}

		PirToken peek() {
			return tokens.get(current);
		}

		PirToken advance() {
			PirToken token = tokens.get(current);
			if (token.type() != TokenType.EOF) {
				current++;
			}
			return token;
		}

		boolean check(TokenType type) {
			return peek().type() == type;
		}

		boolean checkNext(TokenType type) {
			return current + 1 < tokens.size() && tokens.get(current + 1).type() == type;
		}

		PirToken expect(TokenType type, String description) {
			PirToken token = peek();
			if (token.type() != type) {
				throw error("Expected " + description + " but found " + token, token, description);
			}
			return advance();
		}

		PirToken expectIdentifier(String keyword) {
			PirToken token = peek();
			if (!token.isIdentifier(keyword)) {
				throw error("Expected '" + keyword + "' but found " + token, token, "'" + keyword + "'");
			}
			return advance();
		}

		PirSyntaxException error(String message, PirToken token, String expected) {
			return new PirSyntaxException(message, token.span(), expected, token.toString());
		}
	}
}
