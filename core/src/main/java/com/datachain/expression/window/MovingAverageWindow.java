package com.datachain.expression.window;

import java.util.Objects;

/**
 * Average of a measure over a frame of {@code period} rows.
 *
 * <ul>
 *   <li>BEHIND: the current row and {@code period - 1} preceding rows</li>
 *   <li>AHEAD: the current row and {@code period - 1} following rows</li>
 *   <li>CENTERED: {@code period} rows around the current row, the extra row
 *       going to the following side for even periods</li>
 * </ul>
 */
public record MovingAverageWindow(int period, Mode mode) implements MeasureWindow {

    public enum Mode {
        AHEAD,
        BEHIND,
        CENTERED
    }

    public MovingAverageWindow {
        Objects.requireNonNull(mode, "mode must not be null");
    }

    public static MovingAverageWindow behind(int period) {
        return new MovingAverageWindow(period, Mode.BEHIND);
    }
}
