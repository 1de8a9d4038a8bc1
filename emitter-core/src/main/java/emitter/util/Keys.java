package emitter.util;

import java.util.Objects;

/**
 * Event key validation shared by the registry and the emitters.
 */
public final class Keys {

    private Keys() {
    }

    /**
     * Checks that {@code key} is usable as an event key.
     *
     * @param key the key
     * @return the key
     * @throws NullPointerException if {@code key} is null
     * @throws IllegalArgumentException if {@code key} is blank
     */
    public static String check(String key) {
        Objects.requireNonNull(key, "key");
        if (key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        return key;
    }
}
