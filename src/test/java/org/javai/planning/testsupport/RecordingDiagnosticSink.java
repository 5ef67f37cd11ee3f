package org.javai.planning.testsupport;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.javai.planning.diagnostics.DiagnosticSink;

/**
 * Keeps every published message in order.
 */
public class RecordingDiagnosticSink implements DiagnosticSink {

	public record Published(String channel, Object message) {
	}

	private final List<Published> published = new CopyOnWriteArrayList<>();

	@Override
	public void publish(String channel, Object message) {
		published.add(new Published(channel, message));
	}

	public List<Published> published() {
		return List.copyOf(published);
	}

	public List<String> channels() {
		return published.stream().map(Published::channel).toList();
	}

	public <T> List<T> messagesOn(String channel, Class<T> type) {
		return published.stream()
				.filter(p -> p.channel().equals(channel))
				.map(Published::message)
				.map(type::cast)
				.toList();
	}
}
