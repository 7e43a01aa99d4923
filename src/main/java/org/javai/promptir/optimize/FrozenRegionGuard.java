package org.javai.promptir.optimize;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.javai.promptir.ir.Declaration;
import org.javai.promptir.pirtxt.PirPrinter;
import org.javai.promptir.spec.PromptSpec;

/**
 * Compares a spec before and after optimization and rejects changes outside optimizable
 * entities.
 * <p>
 * Frozen entities are compared by their canonical PIR-TXT, so they must survive byte for
 * byte. An optimizable section may change its text and description; an optimizable input
 * its hints. Names, order, templates and render settings never change.
 */
public class FrozenRegionGuard {

	private final PirPrinter printer;

	public FrozenRegionGuard() {
		this(new PirPrinter());
	}

	public FrozenRegionGuard(PirPrinter printer) {
		this.printer = Objects.requireNonNull(printer, "printer must not be null");
	}

	/**
	 * @throws FrozenRegionViolationException on the first forbidden change
	 */
	public void check(PromptSpec before, PromptSpec after) {
		require(before.name().equals(after.name()), before.name(),
				"Optimizer renamed spec '" + before.name() + "' to '" + after.name() + "'");
		require(before.systemTemplate().equals(after.systemTemplate()), "system template",
				"Optimizer changed the system template of '" + before.name() + "'");
		require(before.userTemplate().equals(after.userTemplate()), "user template",
				"Optimizer changed the user template of '" + before.name() + "'");
		require(before.engine().equals(after.engine()) && before.strict() == after.strict(), "render",
				"Optimizer changed the render settings of '" + before.name() + "'");

		checkEntities("input", before.inputs(), after.inputs(), input -> input.optimizable()
				? input.withHints(Map.of())
				: input);
		checkEntities("section", before.sections(), after.sections(), section -> section.optimizable()
				? section.withText("").withDescription(null)
				: section);
	}

	private <T extends Declaration> void checkEntities(String label, List<T> before, List<T> after,
			Function<T, T> frozenPart) {
		List<String> beforeNames = before.stream().map(Declaration::name).toList();
		List<String> afterNames = after.stream().map(Declaration::name).toList();
		require(beforeNames.equals(afterNames), label,
				"Optimizer changed the " + label + "s from " + beforeNames + " to " + afterNames);
		for (int i = 0; i < before.size(); i++) {
			T original = before.get(i);
			T candidate = after.get(i);
			String expected = printer.printDeclaration(frozenPart.apply(original));
			String actual = printer.printDeclaration(frozenPart.apply(candidate));
			require(expected.equals(actual), original.name(), original.optimizable()
					? "Optimizer changed frozen attributes of optimizable " + label + " '" + original.name() + "'"
					: "Optimizer changed frozen " + label + " '" + original.name() + "': " + expected + " became " + actual);
		}
	}

	private static void require(boolean condition, String entity, String message) {
		if (!condition) {
			throw new FrozenRegionViolationException(entity, message);
		}
	}
}
