package com.tablehub.combatservice.support;

import com.tablehub.combatservice.platform.notify.HubTransport;
import com.tablehub.combatservice.platform.transport.Envelope;

import java.util.ArrayList;
import java.util.List;

/**
 * 记录所有分组推送，供断言使用。
 */
public class RecordingHubTransport implements HubTransport {

    public record Sent(String group, Envelope<?> envelope) {
        public String event() {
            return envelope.getEvent();
        }
    }

    private final List<Sent> sent = new ArrayList<>();

    @Override
    public synchronized void sendToGroup(String group, Envelope<?> envelope) {
        sent.add(new Sent(group, envelope));
    }

    public synchronized List<Sent> sent() {
        return List.copyOf(sent);
    }

    public synchronized List<String> events() {
        return sent.stream().map(Sent::event).toList();
    }

    public synchronized List<Sent> ofEvent(String event) {
        return sent.stream().filter(s -> s.event().equals(event)).toList();
    }

    public synchronized void clear() {
        sent.clear();
    }
}
