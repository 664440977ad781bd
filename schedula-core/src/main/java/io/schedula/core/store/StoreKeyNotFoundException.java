package io.schedula.core.store;

import java.io.IOException;

/**
 * Raised when a list key, or an item matching the given criteria, does not exist.
 */
public final class StoreKeyNotFoundException extends IOException {

    public StoreKeyNotFoundException(String message) {
        super(message);
    }
}
