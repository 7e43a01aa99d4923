package org.javai.promptir.spec;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The marker sublanguage the core understands inside template text.
 * <p>
 * Exactly two canonical markers are recognised: {@code {{> name }}} embeds a section and
 * {@code {{ inputs.name }}} embeds an input. Any other text, including other renderer
 * syntax and non-canonical spellings of the markers, is opaque literal text.
 */
public final class TemplateMarkers {

	private static final String NAME = "[A-Za-z_][A-Za-z0-9_.\\-]*";
	private static final String INPUT_NAME = "[A-Za-z_][A-Za-z0-9_\\-]*";

	private static final Pattern CANONICAL = Pattern.compile(
			"\\{\\{> (" + NAME + ") }}|\\{\\{ inputs\\.(" + INPUT_NAME + ") }}");

	// Any spelling the renderer would resolve as an input variable, including {{{ inputs.x }}}.
	private static final Pattern INPUT_REFERENCE = Pattern.compile(
			"\\{\\{\\{?[&]?\\s*inputs\\.(" + INPUT_NAME + ")\\s*}?}}");

	private static final Pattern SECTION_EMBED = Pattern.compile("\\{\\{>\\s*(" + NAME + ")\\s*}}");

	private TemplateMarkers() {
	}

	/**
	 * A run of template text: literal text, a section embed or an input placeholder.
	 */
	public sealed interface Segment {

		record Text(String text) implements Segment {
		}

		record SectionEmbed(String name) implements Segment {
		}

		record InputPlaceholder(String name) implements Segment {
		}
	}

	public static String sectionEmbed(String name) {
		return "{{> " + name + " }}";
	}

	public static String inputPlaceholder(String name) {
		return "{{ inputs." + name + " }}";
	}

	/**
	 * Splits a template at canonical markers. Empty text runs are dropped.
	 */
	public static List<Segment> split(String template) {
		List<Segment> segments = new ArrayList<>();
		Matcher matcher = CANONICAL.matcher(template);
		int last = 0;
		while (matcher.find()) {
			if (matcher.start() > last) {
				segments.add(new Segment.Text(template.substring(last, matcher.start())));
			}
			if (matcher.group(1) != null) {
				segments.add(new Segment.SectionEmbed(matcher.group(1)));
			} else {
				segments.add(new Segment.InputPlaceholder(matcher.group(2)));
			}
			last = matcher.end();
		}
		if (last < template.length()) {
			segments.add(new Segment.Text(template.substring(last)));
		}
		return segments;
	}

	/**
	 * Input names referenced by any spelling the renderer resolves, in order of first use.
	 */
	public static Set<String> referencedInputs(String text) {
		Set<String> names = new LinkedHashSet<>();
		Matcher matcher = INPUT_REFERENCE.matcher(text);
		while (matcher.find()) {
			names.add(matcher.group(1));
		}
		return names;
	}

	/**
	 * Section names embedded in a text, in order of first use, tolerating extra whitespace.
	 */
	public static Set<String> embeddedSections(String text) {
		Set<String> names = new LinkedHashSet<>();
		Matcher matcher = SECTION_EMBED.matcher(text);
		while (matcher.find()) {
			names.add(matcher.group(1));
		}
		return names;
	}

	/**
	 * Replaces every section embed with the text supplied for the embedded name.
	 */
	public static String replaceSectionEmbeds(String text, Function<String, String> replacement) {
		Matcher matcher = SECTION_EMBED.matcher(text);
		StringBuilder sb = new StringBuilder();
		while (matcher.find()) {
			matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement.apply(matcher.group(1))));
		}
		matcher.appendTail(sb);
		return sb.toString();
	}
}
