package org.javai.promptir.optimize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.javai.promptir.ir.HintValue;
import org.javai.promptir.ir.InputDecl;
import org.javai.promptir.ir.ScalarKind;
import org.javai.promptir.ir.SectionDecl;
import org.javai.promptir.lint.DiagnosticCode;
import org.javai.promptir.render.RenderedMessage;
import org.javai.promptir.spec.PromptSpec;
import org.javai.promptir.testsupport.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OptimizerTest {

	private static final Evaluator NO_MODEL = new Evaluator() {
		@Override
		public String run(List<RenderedMessage> messages) {
			return "";
		}

		@Override
		public double score(String output, String label) {
			return 0;
		}
	};

	private final Optimizer optimizer = new Optimizer();
	private OptimizerRegistry registry;

	@BeforeEach
	void setUp() {
		registry = new OptimizerRegistry();
	}

	private PromptSpec run(OptimizerBackend backend) {
		registry.register("test", () -> backend);
		return optimizer.optimize(registry, "test", Fixtures.summarizerSpec(), NO_MODEL);
	}

	@Test
	void acceptsRewriteOfOptimizableSection() {
		PromptSpec optimized = run(request -> request.spec().withSection(
				request.spec().section("style").orElseThrow().withText("Use bullet points.")));

		PromptSpec original = Fixtures.summarizerSpec();
		assertThat(optimized.section("style").orElseThrow().text()).isEqualTo("Use bullet points.");
		assertThat(optimized.section("rules")).isEqualTo(original.section("rules"));
		assertThat(optimized.inputs()).isEqualTo(original.inputs());
		assertThat(optimized.systemTemplate()).isEqualTo(original.systemTemplate());
	}

	@Test
	void acceptsHintsOnOptimizableInput() {
		PromptSpec optimized = run(request -> request.spec().withInput(
				request.spec().input("audience").orElseThrow().withHints(Map.of("temperature", new HintValue.Num(new BigDecimal("0.2"))))));

		assertThat(optimized.input("audience").orElseThrow().hints()).containsKey("temperature");
	}

	@Test
	void acceptsUnchangedSpec() {
		assertThat(run(OptimizationRequest::spec)).isEqualTo(Fixtures.summarizerSpec());
	}

	@Test
	void rejectsRewriteOfFrozenSection() {
		assertThatThrownBy(() -> run(request -> request.spec().withSection(
				request.spec().section("rules").orElseThrow().withText("Invent freely."))))
				.isInstanceOf(FrozenRegionViolationException.class)
				.satisfies(e -> assertThat(((FrozenRegionViolationException) e).entity()).isEqualTo("rules"));
	}

	@Test
	void rejectsHintsOnFrozenInput() {
		assertThatThrownBy(() -> run(request -> request.spec().withInput(
				request.spec().input("document").orElseThrow().withHints(Map.of("max", new HintValue.Bool(true))))))
				.isInstanceOf(FrozenRegionViolationException.class)
				.satisfies(e -> assertThat(((FrozenRegionViolationException) e).entity()).isEqualTo("document"));
	}

	@Test
	void rejectsFlippingOptimizableFlag() {
		assertThatThrownBy(() -> run(request -> request.spec().withSection(
				request.spec().section("style").orElseThrow().withOptimizable(false))))
				.isInstanceOf(FrozenRegionViolationException.class);
	}

	@Test
	void rejectsTemplateChanges() {
		assertThatThrownBy(() -> run(request -> {
			PromptSpec spec = request.spec();
			return new PromptSpec(spec.name(), spec.inputs(), spec.sections(), "{{> style }}",
					spec.userTemplate(), spec.engine(), spec.strict());
		}))
				.isInstanceOf(FrozenRegionViolationException.class)
				.satisfies(e -> assertThat(((FrozenRegionViolationException) e).entity()).isEqualTo("system template"));
	}

	@Test
	void rejectsAddedSection() {
		assertThatThrownBy(() -> run(request -> {
			PromptSpec spec = request.spec();
			List<SectionDecl> sections = new ArrayList<>(spec.sections());
			sections.add(SectionDecl.of("extra", "system", "Be brief.").withOptimizable(true));
			return new PromptSpec(spec.name(), spec.inputs(), sections, spec.systemTemplate(),
					spec.userTemplate(), spec.engine(), spec.strict());
		}))
				.isInstanceOf(FrozenRegionViolationException.class)
				.hasMessageContaining("extra");
	}

	@Test
	void backendReceivesLintDiagnostics() {
		PromptSpec spec = new PromptSpec("lonely",
				List.of(InputDecl.of("text", ScalarKind.STRING, "user")),
				List.of(SectionDecl.of("unused", "system", "Never shown.")),
				"", "{{ inputs.text }}", "mustache", false);
		AtomicReference<OptimizationRequest> seen = new AtomicReference<>();
		registry.register("spy", () -> request -> {
			seen.set(request);
			return request.spec();
		});

		optimizer.optimize(registry, "spy", spec, NO_MODEL);

		assertThat(seen.get().diagnostics()).extracting(d -> d.code()).containsExactly(DiagnosticCode.UNUSED_SECTION);
		assertThat(seen.get().evaluator()).isSameAs(NO_MODEL);
	}

	@Test
	void unknownBackendIsReported() {
		assertThatThrownBy(() -> optimizer.optimize(registry, "missing", Fixtures.summarizerSpec(), NO_MODEL))
				.isInstanceOf(OptimizerNotFoundException.class)
				.hasMessageContaining("missing");
	}

	@Test
	void backendReturningNothingFails() {
		assertThatThrownBy(() -> run(request -> null)).isInstanceOf(IllegalStateException.class);
	}
}
