package org.javai.promptir.render;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheException;
import com.github.mustachejava.reflect.ReflectionObjectHandler;
import com.github.mustachejava.util.Wrapper;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import java.util.Map;

/**
 * {@link TemplateRenderer} backed by mustache.java.
 * <p>
 * Prompts are not HTML, so values are written unescaped. Partials ({@code {{> name }}}) are
 * never loaded: rendering reads nothing but the template and its bindings. Under strict
 * rendering every tag the engine resolves must find a value, whatever its name.
 */
public class MustacheTemplateRenderer implements TemplateRenderer {

	public static final String ENGINE = "mustache";

	private static final String SCOPE = "inputs";

	private final DefaultMustacheFactory lenientFactory = new RawMustacheFactory(false);
	private final DefaultMustacheFactory strictFactory = new RawMustacheFactory(true);

	@Override
	public String engine() {
		return ENGINE;
	}

	@Override
	public String render(String template, Map<String, Object> bindings, boolean strict) {
		DefaultMustacheFactory factory = strict ? strictFactory : lenientFactory;
		try {
			Mustache mustache = factory.compile(new StringReader(template), "prompt");
			StringWriter out = new StringWriter();
			mustache.execute(out, Map.of(SCOPE, bindings));
			return out.toString();
		} catch (MustacheException e) {
			TemplateException cause = templateCause(e);
			if (cause != null) {
				throw cause;
			}
			throw new TemplateException(TemplateException.Kind.ENGINE_FAILURE, null, null,
					"Mustache could not render template: " + e.getMessage(), e);
		}
	}

	private static TemplateException templateCause(Throwable e) {
		for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
			if (cause instanceof TemplateException templateException) {
				return templateException;
			}
		}
		return null;
	}

	/**
	 * Strips the bindings scope so errors name the input rather than the tag.
	 */
	private static String symbolOf(String tag) {
		return tag.startsWith(SCOPE + ".") ? tag.substring(SCOPE.length() + 1) : tag;
	}

	private static final class RawMustacheFactory extends DefaultMustacheFactory {

		RawMustacheFactory(boolean strict) {
			if (strict) {
				setObjectHandler(new StrictObjectHandler());
			}
		}

		@Override
		public void encode(String value, Writer writer) {
			try {
				writer.write(value);
			} catch (IOException e) {
				throw new UncheckedIOException(e);
			}
		}

		@Override
		public Reader getReader(String resourceName) {
			throw new TemplateException(TemplateException.Kind.UNKNOWN_VARIABLE, resourceName,
					"Template includes partial '" + resourceName + "'; only declared sections can be embedded");
		}
	}

	/**
	 * Fails the render when a tag resolves to nothing.
	 */
	private static final class StrictObjectHandler extends ReflectionObjectHandler {

		@Override
		public Wrapper find(String name, List<Object> scopes) {
			Wrapper wrapper = super.find(name, scopes);
			return callScopes -> {
				Object value = wrapper.call(callScopes);
				if (value == null) {
					String symbol = symbolOf(name);
					throw new TemplateException(TemplateException.Kind.MISSING_VARIABLE, symbol,
							"No value for template variable '" + name + "'");
				}
				return value;
			};
		}
	}
}
