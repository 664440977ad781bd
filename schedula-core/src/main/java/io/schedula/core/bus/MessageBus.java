package io.schedula.core.bus;

import java.util.Optional;

public interface MessageBus {
    void publish(ClientUpdate update);

    Optional<ClientUpdate> poll();
}
