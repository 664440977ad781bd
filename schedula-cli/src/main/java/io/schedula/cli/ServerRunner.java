package io.schedula.cli;

@FunctionalInterface
public interface ServerRunner {
    /**
     * Blocks until the server stops. {@code null} arguments fall back to the configured values.
     */
    int run(String hostOverride, Integer portOverride) throws Exception;
}
