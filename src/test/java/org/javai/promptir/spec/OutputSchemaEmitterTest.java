package org.javai.promptir.spec;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.javai.promptir.ir.OutputField;
import org.javai.promptir.ir.ScalarKind;
import org.javai.promptir.ir.SectionDecl;
import org.junit.jupiter.api.Test;

class OutputSchemaEmitterTest {

	@Test
	void emitsPropertiesAndRequiredKeysInSectionOrder() {
		PromptSpec spec = PromptSpec.of("triage", List.of(), List.of(
				SectionDecl.of("label", null, "Pick a label.")
						.withOutput(new OutputField("label", ScalarKind.ENUM, true, "ticket label")),
				SectionDecl.of("confidence", null, "Rate yourself.")
						.withOutput(OutputField.of("confidence", ScalarKind.FLOAT)),
				SectionDecl.of("plain", null, "No output.")),
				"", "");

		ObjectNode schema = OutputSchemaEmitter.emit(spec);

		assertThat(schema.get("type").asText()).isEqualTo("object");
		assertThat(schema.get("title").asText()).isEqualTo("triage");
		assertThat(schema.get("properties").fieldNames()).toIterable().containsExactly("label", "confidence");
		assertThat(schema.at("/properties/label/type").asText()).isEqualTo("string");
		assertThat(schema.at("/properties/label/description").asText()).isEqualTo("ticket label");
		assertThat(schema.at("/properties/confidence/type").asText()).isEqualTo("number");
		assertThat(schema.get("required")).hasSize(1);
		assertThat(schema.get("required").get(0).asText()).isEqualTo("label");
		assertThat(schema.get("additionalProperties").asBoolean()).isFalse();
	}

	@Test
	void firstSectionClaimingAKeyWins() {
		PromptSpec spec = PromptSpec.of("dup", List.of(), List.of(
				SectionDecl.of("a", null, "").withOutput(OutputField.of("answer", ScalarKind.INT)),
				SectionDecl.of("b", null, "").withOutput(OutputField.of("answer", ScalarKind.STRING))),
				"", "");

		assertThat(OutputSchemaEmitter.emit(spec).at("/properties/answer/type").asText()).isEqualTo("integer");
	}
}
