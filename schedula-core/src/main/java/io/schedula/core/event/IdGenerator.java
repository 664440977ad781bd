package io.schedula.core.event;

@FunctionalInterface
public interface IdGenerator {
    String newId(String prefix);
}
