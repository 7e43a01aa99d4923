package org.javai.promptir.render;

import java.util.Map;

/**
 * Renders template text in which inputs are reachable as {@code inputs.<name>}.
 */
public interface TemplateRenderer {

	/**
	 * Name matched against a module's render engine.
	 */
	String engine();

	/**
	 * @param bindings input name to value
	 * @param strict fail on any template variable that resolves to nothing instead of rendering it empty
	 * @throws TemplateException if rendering fails
	 */
	String render(String template, Map<String, Object> bindings, boolean strict);
}
