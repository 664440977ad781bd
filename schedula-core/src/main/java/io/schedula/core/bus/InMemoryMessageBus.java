package io.schedula.core.bus;

import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;

public final class InMemoryMessageBus implements MessageBus {
    private final ConcurrentLinkedQueue<ClientUpdate> queue = new ConcurrentLinkedQueue<>();

    @Override
    public void publish(ClientUpdate update) {
        queue.offer(update);
    }

    @Override
    public Optional<ClientUpdate> poll() {
        return Optional.ofNullable(queue.poll());
    }
}
