package org.javai.promptir.ir;

import java.util.Arrays;
import java.util.Optional;

/**
 * Scalar kinds an input or an output field can declare.
 */
public enum ScalarKind {

	STRING("string"),
	INT("int"),
	FLOAT("float"),
	BOOL("bool"),
	ENUM("enum");

	private final String keyword;

	ScalarKind(String keyword) {
		this.keyword = keyword;
	}

	/**
	 * The keyword used for this kind in PIR-TXT.
	 */
	public String keyword() {
		return keyword;
	}

	public static Optional<ScalarKind> fromKeyword(String keyword) {
		return Arrays.stream(values())
				.filter(kind -> kind.keyword.equals(keyword))
				.findFirst();
	}
}
