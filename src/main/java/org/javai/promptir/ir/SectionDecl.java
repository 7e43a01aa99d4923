package org.javai.promptir.ir;

/**
 * A named, reusable block of template text.
 * <p>
 * The text is opaque to the core apart from the section-embed and input-placeholder
 * markers it may contain.
 *
 * @param name symbol name, unique among the module's sections
 * @param channel channel tag the section belongs to, may be null
 * @param text template text handed to the renderer
 * @param optimizable whether optimizer passes may rewrite the text
 * @param description human description, may be null
 * @param output output field descriptor, may be null
 */
public record SectionDecl(
		String name,
		String channel,
		String text,
		boolean optimizable,
		String description,
		OutputField output
) implements Declaration {

	public SectionDecl {
		Identifiers.require(name, "section name");
		text = text == null ? "" : text;
	}

	public static SectionDecl of(String name, String channel, String text) {
		return new SectionDecl(name, channel, text, false, null, null);
	}

	public SectionDecl withText(String text) {
		return new SectionDecl(name, channel, text, optimizable, description, output);
	}

	public SectionDecl withOptimizable(boolean optimizable) {
		return new SectionDecl(name, channel, text, optimizable, description, output);
	}

	public SectionDecl withDescription(String description) {
		return new SectionDecl(name, channel, text, optimizable, description, output);
	}

	public SectionDecl withOutput(OutputField output) {
		return new SectionDecl(name, channel, text, optimizable, description, output);
	}

	@Override
	public SymbolKind symbolKind() {
		return SymbolKind.SECTION;
	}
}
