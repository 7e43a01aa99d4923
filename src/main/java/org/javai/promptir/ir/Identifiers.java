package org.javai.promptir.ir;

import java.util.regex.Pattern;

/**
 * Naming rules shared by the data model and the PIR-TXT codec.
 * <p>
 * Every name the printer writes bare (module, declaration and hint names, and the names
 * operations refer to) must be a PIR-TXT identifier, so that printed modules parse back.
 */
public final class Identifiers {

	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_.\\-]*");
	private static final Pattern VERSION = Pattern.compile("v\\d+(\\.\\d+)*");

	private Identifiers() {
	}

	public static boolean isIdentifier(String value) {
		return value != null && IDENTIFIER.matcher(value).matches();
	}

	public static boolean isVersion(String value) {
		return value != null && VERSION.matcher(value).matches();
	}

	/**
	 * Returns {@code value} if it is a valid identifier.
	 *
	 * @param what what the name identifies, used in the error message
	 * @throws NullPointerException if the value is null
	 * @throws IllegalArgumentException if the value is not an identifier
	 */
	public static String require(String value, String what) {
		if (value == null) {
			throw new NullPointerException(what + " must not be null");
		}
		if (!isIdentifier(value)) {
			throw new IllegalArgumentException("Invalid " + what + " '" + value
					+ "': expected a letter or '_' followed by letters, digits, '_', '.' or '-'");
		}
		return value;
	}
}
