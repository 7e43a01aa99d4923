package org.javai.promptir.config;

import java.util.Objects;
import java.util.Set;

/**
 * Library-wide settings.
 *
 * @param formatVersion version tag written by lowering, e.g. {@code v1.0}
 * @param supportedMajorVersions PIR-TXT major versions the parser accepts
 * @param defaultEngine render engine used when a module has no render configuration
 * @param defaultStrict strict flag used when a module has no render configuration
 * @param enforceUnknownInputs default for rejecting bindings and references to undeclared inputs
 * @param indent indentation unit used by the printer
 */
public record PirSettings(
		String formatVersion,
		Set<Integer> supportedMajorVersions,
		String defaultEngine,
		boolean defaultStrict,
		boolean enforceUnknownInputs,
		String indent
) {

	public static final String DEFAULTS_RESOURCE = "META-INF/promptir/defaults.yml";

	public PirSettings {
		Objects.requireNonNull(formatVersion, "formatVersion must not be null");
		Objects.requireNonNull(defaultEngine, "defaultEngine must not be null");
		Objects.requireNonNull(indent, "indent must not be null");
		supportedMajorVersions = supportedMajorVersions == null ? Set.of() : Set.copyOf(supportedMajorVersions);
		if (supportedMajorVersions.isEmpty()) {
			throw new IllegalArgumentException("At least one supported major version is required");
		}
	}

	/**
	 * Settings bundled with the library, loaded once from {@value #DEFAULTS_RESOURCE}.
	 */
	public static PirSettings defaults() {
		return Holder.DEFAULTS;
	}

	public boolean supportsMajorVersion(int major) {
		return supportedMajorVersions.contains(major);
	}

	public PirSettings withEnforceUnknownInputs(boolean enforceUnknownInputs) {
		return new PirSettings(formatVersion, supportedMajorVersions, defaultEngine, defaultStrict, enforceUnknownInputs, indent);
	}

	public PirSettings withIndent(String indent) {
		return new PirSettings(formatVersion, supportedMajorVersions, defaultEngine, defaultStrict, enforceUnknownInputs, indent);
	}

	private static final class Holder {
		private static final PirSettings DEFAULTS = new PirSettingsLoader()
				.loadResource(DEFAULTS_RESOURCE, PirSettings.class.getClassLoader());
	}
}
