package io.qoms;

/**
 * Priority tier of a queued operation. A lower {@link #code()} means a higher priority;
 * the scheduler drains {@code CRITICAL} first and {@code IDLE} last.
 */
public enum Priority {
    /** Always admitted, never blocked by resource ceilings. */
    CRITICAL(0),
    HIGH(1),
    MEDIUM(2),
    LOW(3),
    /** Only admitted while the host is nearly idle. */
    IDLE(4);

    private static final Priority[] BY_CODE = values();

    private final int code;

    Priority(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Returns the tier one step above this one. {@code CRITICAL} maps to itself.
     *
     * @return the next higher tier
     */
    public Priority promoted() {
        return this == CRITICAL ? CRITICAL : BY_CODE[code - 1];
    }

    /**
     * Looks up a tier by its numeric code.
     *
     * @param code the tier code, {@code 0..4}
     * @return the matching tier
     * @throws IllegalArgumentException if no tier has this code
     */
    public static Priority fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            throw new IllegalArgumentException("Unknown priority code: " + code);
        }
        return BY_CODE[code];
    }
}
