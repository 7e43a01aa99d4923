package org.javai.promptir.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PirSettingsLoaderTest {

	private final PirSettingsLoader loader = new PirSettingsLoader();

	@Test
	void bundledDefaults() {
		PirSettings settings = PirSettings.defaults();

		assertThat(settings.formatVersion()).isEqualTo("v1.0");
		assertThat(settings.supportedMajorVersions()).containsExactly(1);
		assertThat(settings.defaultEngine()).isEqualTo("mustache");
		assertThat(settings.defaultStrict()).isFalse();
		assertThat(settings.enforceUnknownInputs()).isFalse();
		assertThat(settings.indent()).isEqualTo("\t");
	}

	@Test
	void missingKeysFallBackToDefaults() {
		PirSettings settings = loader.loadString("""
				render:
				  enforce_unknown_inputs: true
				""");

		assertThat(settings.enforceUnknownInputs()).isTrue();
		assertThat(settings.formatVersion()).isEqualTo("v1.0");
		assertThat(settings.supportedMajorVersions()).containsExactly(1);
		assertThat(settings.indent()).isEqualTo("\t");
	}

	@Test
	void overridesEveryKey() {
		PirSettings settings = loader.loadString("""
				format:
				  version: v2.1
				  supported_major_versions: [1, 2]
				  indent: "  "
				render:
				  default_engine: jinja2
				  default_strict: true
				""");

		assertThat(settings.formatVersion()).isEqualTo("v2.1");
		assertThat(settings.supportsMajorVersion(2)).isTrue();
		assertThat(settings.supportsMajorVersion(3)).isFalse();
		assertThat(settings.indent()).isEqualTo("  ");
		assertThat(settings.defaultEngine()).isEqualTo("jinja2");
		assertThat(settings.defaultStrict()).isTrue();
	}

	@Test
	void loadsFromPath(@TempDir Path dir) throws IOException {
		Path file = dir.resolve("promptir.yml");
		Files.writeString(file, "render:\n  default_strict: true\n");

		assertThat(loader.load(file).defaultStrict()).isTrue();
	}

	@Test
	void missingFileIsAConfigurationError(@TempDir Path dir) {
		assertThatThrownBy(() -> loader.load(dir.resolve("absent.yml")))
				.isInstanceOf(ConfigurationException.class)
				.hasMessageContaining("absent.yml");
	}

	@Test
	void malformedYamlIsAConfigurationError() {
		assertThatThrownBy(() -> loader.loadString("format: [unclosed"))
				.isInstanceOf(ConfigurationException.class)
				.hasCauseInstanceOf(Exception.class);
	}

	@Test
	void rejectsNonMappingDocument() {
		assertThatThrownBy(() -> loader.loadString("- a\n- b\n"))
				.isInstanceOf(ConfigurationException.class)
				.hasMessageContaining("mapping");
	}

	@Test
	void rejectsNonNumericMajorVersion() {
		assertThatThrownBy(() -> loader.loadString("format:\n  supported_major_versions: [one]\n"))
				.isInstanceOf(ConfigurationException.class)
				.hasMessageContaining("one");
	}

	@Test
	void missingResourceIsReported() {
		assertThatThrownBy(() -> loader.loadResource("META-INF/promptir/absent.yml", getClass().getClassLoader()))
				.isInstanceOf(ConfigurationException.class)
				.hasMessageContaining("Resource not found");
	}

	@Test
	void settingsRequireAMajorVersion() {
		assertThatThrownBy(() -> loader.loadString("format:\n  supported_major_versions: []\n"))
				.isInstanceOf(ConfigurationException.class)
				.hasRootCauseInstanceOf(IllegalArgumentException.class);
	}
}
