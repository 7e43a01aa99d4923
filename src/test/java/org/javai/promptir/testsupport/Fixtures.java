package org.javai.promptir.testsupport;

import java.util.List;
import org.javai.promptir.ir.EmitOp;
import org.javai.promptir.ir.InputDecl;
import org.javai.promptir.ir.Message;
import org.javai.promptir.ir.PirModule;
import org.javai.promptir.ir.RenderConfig;
import org.javai.promptir.ir.ScalarKind;
import org.javai.promptir.ir.SectionDecl;
import org.javai.promptir.ir.SwitchCase;
import org.javai.promptir.spec.PromptSpec;
import org.javai.promptir.symbol.ModuleBuilder;

/**
 * Shared modules and specs for tests.
 */
public final class Fixtures {

	/**
	 * Canonical PIR-TXT of {@link #supportModule()}.
	 */
	public static final String SUPPORT_MODULE_TEXT = String.join("\n",
			"module @demo.support v1.0 {",
			"\ttone : enum { values = [\"formal\", \"casual\"], channel = \"system\", required }",
			"\tquestion : string { channel = \"user\", required }",
			"\t@persona { channel = \"system\", text = \"You are a support agent.\" }",
			"\t@format { channel = \"system\", text = \"Answer in JSON.\" }",
			"\t\"system\" {",
			"\t\tsection persona",
			"\t\tswitch tone {",
			"\t\t\tcase \"formal\" {",
			"\t\t\t\ttext \" Be formal.\"",
			"\t\t\t}",
			"\t\t\tdefault {",
			"\t\t\t\ttext \" Be relaxed.\"",
			"\t\t\t}",
			"\t\t}",
			"\t}",
			"\t\"user\" {",
			"\t\tinput question",
			"\t}",
			"\trender { engine = \"mustache\", strict }",
			"}",
			"");

	private Fixtures() {
	}

	/**
	 * Support module whose {@code format} section is never emitted.
	 */
	public static PirModule supportModule() {
		return ModuleBuilder.module("demo.support")
				.version("v1.0")
				.input(new InputDecl("tone", ScalarKind.ENUM, List.of("formal", "casual"), "system", true, false, null))
				.input(new InputDecl("question", ScalarKind.STRING, List.of(), "user", true, false, null))
				.section(SectionDecl.of("persona", "system", "You are a support agent."))
				.section(SectionDecl.of("format", "system", "Answer in JSON."))
				.message(Message.of(Message.SYSTEM,
						EmitOp.section("persona"),
						new EmitOp.Switch("tone",
								List.of(new SwitchCase("formal", List.of(EmitOp.literal(" Be formal.")))),
								List.of(EmitOp.literal(" Be relaxed.")))))
				.message(Message.of(Message.USER, EmitOp.input("question")))
				.render(new RenderConfig("mustache", true))
				.build();
	}

	/**
	 * Single-predict spec with one frozen and one optimizable section.
	 */
	public static PromptSpec summarizerSpec() {
		return new PromptSpec(
				"summarizer",
				List.of(InputDecl.of("document", ScalarKind.STRING, "user"),
						InputDecl.of("audience", ScalarKind.STRING, null).withOptimizable(true)),
				List.of(SectionDecl.of("rules", "system", "Never invent facts."),
						SectionDecl.of("style", "system", "Write short sentences.").withOptimizable(true)),
				"{{> rules }} {{> style }}",
				"Summarize for {{ inputs.audience }}:\n{{ inputs.document }}",
				"mustache",
				false);
	}
}
