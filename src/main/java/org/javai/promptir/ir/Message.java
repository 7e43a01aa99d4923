package org.javai.promptir.ir;

import java.util.List;
import java.util.Objects;

/**
 * An ordered sequence of emit operations tagged with a channel.
 */
public record Message(String channel, List<EmitOp> ops) {

	public static final String SYSTEM = "system";
	public static final String USER = "user";

	public Message {
		Objects.requireNonNull(channel, "channel must not be null");
		ops = ops == null ? List.of() : List.copyOf(ops);
	}

	public static Message of(String channel, EmitOp... ops) {
		return new Message(channel, List.of(ops));
	}
}
