package org.javai.promptir.ir;

import java.util.Objects;

/**
 * One candidate wording of a slot.
 */
public record SlotOption(String id, String text) {

	public SlotOption {
		Objects.requireNonNull(id, "id must not be null");
		text = text == null ? "" : text;
	}
}
