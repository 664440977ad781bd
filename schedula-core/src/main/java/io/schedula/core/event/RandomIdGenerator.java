package io.schedula.core.event;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Generates short ids of the form {@code <prefix><base36 millis><base36 random>}, matching {@code ^\w+$}.
 */
public final class RandomIdGenerator implements IdGenerator {
    private final SecureRandom random = new SecureRandom();
    private final Clock clock;

    public RandomIdGenerator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String newId(String prefix) {
        String time = Long.toString(clock.millis(), 36);
        String noise = Long.toString(random.nextLong() & Long.MAX_VALUE, 36);
        String suffix = noise.length() > 6 ? noise.substring(0, 6) : noise;
        return (prefix == null ? "" : prefix) + time + suffix;
    }
}
