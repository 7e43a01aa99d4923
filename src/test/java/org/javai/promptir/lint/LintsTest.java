package org.javai.promptir.lint;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.javai.promptir.ir.EmitOp;
import org.javai.promptir.ir.InputDecl;
import org.javai.promptir.ir.Message;
import org.javai.promptir.ir.OutputField;
import org.javai.promptir.ir.PirModule;
import org.javai.promptir.ir.ScalarKind;
import org.javai.promptir.ir.SectionDecl;
import org.javai.promptir.ir.SlotDecl;
import org.javai.promptir.ir.SlotOption;
import org.javai.promptir.ir.SwitchCase;
import org.javai.promptir.pirtxt.PirParser;
import org.javai.promptir.symbol.ModuleBuilder;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LintsTest {

	private static List<Diagnostic> check(Lint lint, PirModule module) {
		return lint.check(LintContext.of(module));
	}

	@Nested
	class UnusedSection {

		@Test
		void flagsSectionNeverEmitted() {
			PirModule module = ModuleBuilder.module("m")
					.section(SectionDecl.of("persona", "system", "You help."))
					.section(SectionDecl.of("format", "system", "Use JSON."))
					.message(Message.of(Message.SYSTEM, EmitOp.section("persona")))
					.build();

			assertThat(check(new UnusedSectionLint(), module)).singleElement().satisfies(d -> {
				assertThat(d.code().id()).isEqualTo("PIR-L001");
				assertThat(d.symbol()).isEqualTo("format");
				assertThat(d.severity()).isEqualTo(Severity.WARNING);
			});
		}

		@Test
		void emitInsideSwitchBranchCountsAsUse() {
			PirModule module = ModuleBuilder.module("m")
					.input(InputDecl.enumeration("mode", List.of("a", "b"), null))
					.section(SectionDecl.of("deep", null, "x"))
					.message(Message.of(Message.USER, new EmitOp.Switch("mode",
							List.of(new SwitchCase("a", List.of())),
							List.of(EmitOp.section("deep")))))
					.build();

			assertThat(check(new UnusedSectionLint(), module)).isEmpty();
		}

		@Test
		void wrongChannelEmitCountsAsUseAndOnlyViolatesChannel() {
			PirModule module = ModuleBuilder.module("m")
					.section(SectionDecl.of("persona", "system", "You help."))
					.message(Message.of(Message.USER, EmitOp.section("persona")))
					.build();

			assertThat(LintEngine.standard().run(module)).extracting(Diagnostic::code)
					.containsExactly(DiagnosticCode.CHANNEL_VIOLATION);
		}
	}

	@Nested
	class UnusedInput {

		@Test
		void switchSubjectCountsAsUse() {
			PirModule module = ModuleBuilder.module("m")
					.input(InputDecl.enumeration("mode", List.of("a"), null))
					.input(InputDecl.of("idle", ScalarKind.INT, null))
					.message(Message.of(Message.USER, new EmitOp.Switch("mode", List.of(), List.of())))
					.build();

			assertThat(check(new UnusedInputLint(), module)).extracting(Diagnostic::symbol).containsExactly("idle");
		}
	}

	@Nested
	class ChannelViolation {

		@Test
		void inputOnWrongChannel() {
			PirModule module = ModuleBuilder.module("m")
					.input(InputDecl.of("question", ScalarKind.STRING, "user"))
					.message(Message.of(Message.SYSTEM, EmitOp.input("question")))
					.build();

			assertThat(check(new ChannelViolationLint(), module)).singleElement().satisfies(d -> {
				assertThat(d.code()).isEqualTo(DiagnosticCode.CHANNEL_VIOLATION);
				assertThat(d.message()).contains("Input 'question'", "'user'", "'system'");
			});
		}

		@Test
		void undeclaredChannelNeverViolates() {
			PirModule module = ModuleBuilder.module("m")
					.section(SectionDecl.of("shared", null, "x"))
					.message(Message.of(Message.SYSTEM, EmitOp.section("shared")))
					.message(Message.of(Message.USER, EmitOp.section("shared")))
					.build();

			assertThat(check(new ChannelViolationLint(), module)).isEmpty();
		}

		@Test
		void pointsAtTheOffendingReference() {
			String text = String.join("\n",
					"module @m {",
					"  @persona { channel = \"system\", text = \"x\" }",
					"  \"system\" { section persona }",
					"  \"user\" { section persona }",
					"}");

			List<Diagnostic> diagnostics = new ChannelViolationLint().check(LintContext.of(new PirParser().parse(text)));

			assertThat(diagnostics).singleElement()
					.satisfies(d -> assertThat(d.location().sourceSpan().orElseThrow().line()).isEqualTo(4));
		}
	}

	@Nested
	class IncompleteSwitch {

		private PirModule switchOn(InputDecl input, List<SwitchCase> cases, List<EmitOp> defaultOps) {
			return ModuleBuilder.module("m")
					.input(input)
					.message(Message.of(Message.USER, new EmitOp.Switch(input.name(), cases, defaultOps)))
					.build();
		}

		@Test
		void flagsMissingEnumValues() {
			PirModule module = switchOn(InputDecl.enumeration("tone", List.of("formal", "casual", "pirate"), null),
					List.of(new SwitchCase("formal", List.of())), null);

			assertThat(check(new IncompleteSwitchLint(), module)).singleElement()
					.satisfies(d -> assertThat(d.message()).contains("[casual, pirate]"));
		}

		@Test
		void defaultBranchCoversTheRest() {
			PirModule module = switchOn(InputDecl.enumeration("tone", List.of("formal", "casual"), null),
					List.of(new SwitchCase("formal", List.of())), List.of());

			assertThat(check(new IncompleteSwitchLint(), module)).isEmpty();
		}

		@Test
		void allValuesCovered() {
			PirModule module = switchOn(InputDecl.enumeration("tone", List.of("formal", "casual"), null),
					List.of(new SwitchCase("casual", List.of()), new SwitchCase("formal", List.of())), null);

			assertThat(check(new IncompleteSwitchLint(), module)).isEmpty();
		}

		@Test
		void nonEnumInputsAreNotChecked() {
			PirModule module = switchOn(InputDecl.of("flag", ScalarKind.BOOL, null),
					List.of(new SwitchCase("true", List.of())), null);

			assertThat(check(new IncompleteSwitchLint(), module)).isEmpty();
		}
	}

	@Nested
	class SchemaCollision {

		@Test
		void laterSectionCollidesWithConflictingKinds() {
			PirModule module = ModuleBuilder.module("m")
					.section(SectionDecl.of("first", null, "").withOutput(OutputField.of("answer", ScalarKind.STRING)))
					.section(SectionDecl.of("second", null, "").withOutput(OutputField.of("answer", ScalarKind.INT)))
					.build();

			assertThat(check(new SchemaCollisionLint(), module)).singleElement().satisfies(d -> {
				assertThat(d.symbol()).isEqualTo("second");
				assertThat(d.message()).contains("'first'", "conflicting kinds string and int");
			});
		}

		@Test
		void sameKindStillCollides() {
			PirModule module = ModuleBuilder.module("m")
					.section(SectionDecl.of("first", null, "").withOutput(OutputField.of("answer", ScalarKind.STRING)))
					.section(SectionDecl.of("second", null, "").withOutput(OutputField.of("answer", ScalarKind.STRING)))
					.section(SectionDecl.of("third", null, "").withOutput(OutputField.of("other", ScalarKind.STRING)))
					.build();

			assertThat(check(new SchemaCollisionLint(), module)).singleElement()
					.satisfies(d -> assertThat(d.message()).doesNotContain("conflicting"));
		}
	}

	@Nested
	class UnknownSymbolReference {

		@Test
		void flagsEveryUnresolvedKind() {
			PirModule module = ModuleBuilder.module("m")
					.slot(SlotDecl.of("known", List.of(new SlotOption("a", "A"))))
					.message(Message.of(Message.USER,
							EmitOp.section("s"), EmitOp.input("i"), EmitOp.slot("known"), EmitOp.slot("z"),
							new EmitOp.Switch("w", List.of(), null)))
					.build();

			assertThat(check(new UnknownSymbolReferenceLint(), module)).extracting(Diagnostic::symbol)
					.containsExactly("s", "i", "z", "w");
		}
	}
}
