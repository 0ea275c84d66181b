package com.ember.script.vars;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Process-wide variable namespace shared by every running script ({@code $name}).
 *
 * {@code date}, {@code time} and {@code datetime} are computed from the clock on every read.
 */
public final class GlobalVariables extends VariableStore {

    public GlobalVariables(String dateFormat, String timeFormat, String datetimeFormat, Clock clock) {
        DateTimeFormatter date = DateTimeFormatter.ofPattern(dateFormat);
        DateTimeFormatter time = DateTimeFormatter.ofPattern(timeFormat);
        DateTimeFormatter datetime = DateTimeFormatter.ofPattern(datetimeFormat);
        registerComputed("date", () -> date.format(ZonedDateTime.now(clock)));
        registerComputed("time", () -> time.format(ZonedDateTime.now(clock)));
        registerComputed("datetime", () -> datetime.format(ZonedDateTime.now(clock)));
    }
}
