package com.datachain.expression.window;

import java.util.Objects;

/**
 * Difference between a row's value and the value {@code period} rows earlier.
 *
 * <p>ABSOLUTE renders {@code (f - LAG(f, p) OVER (...))}; PERCENTAGE renders
 * the relative change scaled to 100 with a NULLIF guard against division by zero.
 */
public record ChangeWindow(int period, Mode mode) implements MeasureWindow {

    public enum Mode {
        ABSOLUTE,
        PERCENTAGE
    }

    public ChangeWindow {
        Objects.requireNonNull(mode, "mode must not be null");
    }

    public static ChangeWindow absolute(int period) {
        return new ChangeWindow(period, Mode.ABSOLUTE);
    }

    public static ChangeWindow percentage(int period) {
        return new ChangeWindow(period, Mode.PERCENTAGE);
    }
}
