package org.javai.promptir.ir;

/**
 * A named entity declared in a module's body.
 */
public sealed interface Declaration permits InputDecl, SectionDecl, SlotDecl {

	String name();

	SymbolKind symbolKind();

	/**
	 * Whether optimizer passes may alter this declaration.
	 */
	boolean optimizable();
}
