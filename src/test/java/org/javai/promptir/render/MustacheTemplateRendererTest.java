package org.javai.promptir.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MustacheTemplateRendererTest {

	private final MustacheTemplateRenderer renderer = new MustacheTemplateRenderer();

	@Test
	void substitutesInputsScope() {
		String out = renderer.render("Hello {{ inputs.name }}!", Map.of("name", "Ada"), true);

		assertThat(out).isEqualTo("Hello Ada!");
	}

	@Test
	void doesNotHtmlEscapeValues() {
		String out = renderer.render("{{ inputs.code }}", Map.of("code", "a < b && \"c\""), false);

		assertThat(out).isEqualTo("a < b && \"c\"");
	}

	@Test
	void strictRenderingFailsOnMissingBinding() {
		assertThatThrownBy(() -> renderer.render("Hi {{ inputs.name }}", Map.of(), true))
				.isInstanceOf(TemplateException.class)
				.satisfies(e -> {
					TemplateException te = (TemplateException) e;
					assertThat(te.kind()).isEqualTo(TemplateException.Kind.MISSING_VARIABLE);
					assertThat(te.symbol()).isEqualTo("name");
				});
	}

	@Test
	void lenientRenderingLeavesMissingBindingEmpty() {
		assertThat(renderer.render("Hi {{ inputs.name }}.", Map.of(), false)).isEqualTo("Hi .");
	}

	@Test
	void otherMustacheSyntaxIsHonoured() {
		String out = renderer.render("{{#inputs.urgent}}URGENT: {{/inputs.urgent}}{{ inputs.text }}",
				Map.of("urgent", true, "text", "call back"), false);

		assertThat(out).isEqualTo("URGENT: call back");
	}

	@Test
	void malformedTemplateIsAnEngineFailure() {
		assertThatThrownBy(() -> renderer.render("{{#inputs.open}} never closed", Map.of(), false))
				.isInstanceOf(TemplateException.class)
				.satisfies(e -> assertThat(((TemplateException) e).kind()).isEqualTo(TemplateException.Kind.ENGINE_FAILURE));
	}

	@Test
	void strictRenderingFailsOnAnyUnresolvedTag() {
		Map<String, String> templates = Map.of(
				"Hello {{ customer }}!", "customer",
				"{{ inputs.name.first }}", "name.first",
				"{{#inputs.flag}}on{{/inputs.flag}}", "flag",
				"{{{ inputs.raw }}}", "raw");

		templates.forEach((template, symbol) ->
				assertThatThrownBy(() -> renderer.render(template, Map.of("name", "Ada"), true)).as(template)
						.isInstanceOf(TemplateException.class)
						.satisfies(e -> {
							TemplateException te = (TemplateException) e;
							assertThat(te.kind()).isEqualTo(TemplateException.Kind.MISSING_VARIABLE);
							assertThat(te.symbol()).isEqualTo(symbol);
						}));
	}

	@Test
	void strictRenderingResolvesNestedScopes() {
		String out = renderer.render("{{#inputs.items}}[{{ label }}]{{/inputs.items}}",
				Map.of("items", List.of(Map.of("label", "a"), Map.of("label", "b"))), true);

		assertThat(out).isEqualTo("[a][b]");
	}

	@Test
	void lenientRenderingLeavesUnknownTagsEmpty() {
		assertThat(renderer.render("Hello {{ customer }}!", Map.of(), false)).isEqualTo("Hello !");
	}

	@Test
	void partialsAreNeverLoaded() {
		for (String template : List.of("{{> pom.xml }}", "{{>secrets}}", "{{< layout}}{{/layout}}")) {
			assertThatThrownBy(() -> renderer.render(template, Map.of(), false)).as(template)
					.isInstanceOf(TemplateException.class)
					.satisfies(e -> assertThat(((TemplateException) e).kind())
							.isEqualTo(TemplateException.Kind.UNKNOWN_VARIABLE));
		}
	}
}
