package org.javai.promptir.render;

/**
 * A message after rendering, ready to send to a model.
 */
public record RenderedMessage(String channel, String text) {
}
