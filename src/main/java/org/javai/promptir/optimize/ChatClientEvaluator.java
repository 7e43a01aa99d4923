package org.javai.promptir.optimize;

import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.stream.Collectors;
import org.javai.promptir.ir.Message;
import org.javai.promptir.render.RenderedMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * {@link Evaluator} that runs prompts through a Spring AI {@link ChatClient}.
 * <p>
 * System messages are joined into one system prompt and user messages into one user prompt.
 * Scoring is delegated to the supplied function.
 */
public class ChatClientEvaluator implements Evaluator {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientEvaluator.class);

	private static final String SEPARATOR = "\n\n";

	private final ChatClient chatClient;
	private final BiFunction<String, String, Double> scorer;

	public ChatClientEvaluator(ChatClient chatClient, BiFunction<String, String, Double> scorer) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
		this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
	}

	/**
	 * Scores 1.0 for an output equal to the label after trimming, 0.0 otherwise.
	 */
	public static ChatClientEvaluator exactMatch(ChatClient chatClient) {
		return new ChatClientEvaluator(chatClient,
				(output, label) -> output != null && output.trim().equals(label.trim()) ? 1.0 : 0.0);
	}

	@Override
	public String run(List<RenderedMessage> messages) {
		String system = join(messages, Message.SYSTEM);
		String user = join(messages, Message.USER);
		ChatClient.ChatClientRequestSpec request = chatClient.prompt();
		if (!system.isEmpty()) {
			request.system(system);
		}
		if (!user.isEmpty()) {
			request.user(user);
		}
		String content = request.call().content();
		logger.debug("Evaluated prompt ({} system chars, {} user chars): {} response chars",
				system.length(), user.length(), content == null ? 0 : content.length());
		return content;
	}

	@Override
	public double score(String output, String label) {
		return scorer.apply(output, label);
	}

	private static String join(List<RenderedMessage> messages, String channel) {
		return messages.stream()
				.filter(m -> channel.equals(m.channel()))
				.map(RenderedMessage::text)
				.filter(text -> !text.isEmpty())
				.collect(Collectors.joining(SEPARATOR));
	}
}
