package com.datachain.expression.window;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Window transform applied to an aggregated measure across time-grain rows.
 *
 * <p>A windowed measure reads already-aggregated rows, so any query carrying
 * one is compiled in two stages (aggregate, then window).
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ChangeWindow.class, name = "change"),
    @JsonSubTypes.Type(value = MovingAverageWindow.class, name = "moving_average")
})
public sealed interface MeasureWindow permits ChangeWindow, MovingAverageWindow {

    /**
     * Number of rows the window looks across. Must be at least 1.
     */
    int period();
}
