package org.javai.promptir.render;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.javai.promptir.config.PirSettings;

/**
 * Per-call rendering inputs.
 *
 * @param bindings input name to value
 * @param slotChoices slot name to chosen option id; unchosen slots use their first option
 * @param enforceUnknownInputs reject bindings and references naming undeclared inputs
 */
public record RenderOptions(Map<String, Object> bindings, Map<String, String> slotChoices, boolean enforceUnknownInputs) {

	public RenderOptions {
		bindings = bindings == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
		slotChoices = slotChoices == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(slotChoices));
	}

	/**
	 * Options with no slot choices and the configured unknown-input policy.
	 */
	public static RenderOptions of(Map<String, Object> bindings) {
		return new RenderOptions(bindings, Map.of(), PirSettings.defaults().enforceUnknownInputs());
	}

	public RenderOptions withSlotChoice(String slot, String optionId) {
		Map<String, String> choices = new LinkedHashMap<>(slotChoices);
		choices.put(slot, optionId);
		return new RenderOptions(bindings, choices, enforceUnknownInputs);
	}

	public RenderOptions withEnforceUnknownInputs(boolean enforce) {
		return new RenderOptions(bindings, slotChoices, enforce);
	}
}
