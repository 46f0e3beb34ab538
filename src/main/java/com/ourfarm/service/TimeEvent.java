package com.ourfarm.service;

import com.ourfarm.model.Season;

/** Calendar rollover reported by {@link TimeService#tick(double)}. */
public class TimeEvent {

    public enum Type { NEW_DAY, NEW_SEASON }

    private final Type type;
    private final int day;
    private final Season season;

    public TimeEvent(Type type, int day, Season season) {
        this.type = type;
        this.day = day;
        this.season = season;
    }

    public Type getType() { return type; }
    public int getDay() { return day; }
    public Season getSeason() { return season; }
}
