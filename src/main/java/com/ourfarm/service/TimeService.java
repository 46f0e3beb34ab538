package com.ourfarm.service;

import com.ourfarm.config.GameConstants;
import com.ourfarm.model.Season;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Accelerated game calendar. One real second advances the clock by
 * {@link GameConstants#TIME_SCALE} game seconds. The clock only reports
 * rollovers; reacting to them is the caller's job.
 */
@Service
public class TimeService {
    private Season season = Season.SPRING;
    private int day = 1;
    private double hour = GameConstants.START_HOUR;
    private boolean paused = false;

    public void restore(Season season, int day, double hour) {
        this.season = season;
        this.day = day;
        this.hour = hour;
    }

    public static double toGameHours(double realSeconds) {
        return realSeconds * GameConstants.TIME_SCALE / 3600.0;
    }

    public List<TimeEvent> tick(double deltaRealSeconds) {
        List<TimeEvent> events = new ArrayList<>();
        if (paused || deltaRealSeconds <= 0) return events;

        hour += toGameHours(deltaRealSeconds);

        while (hour >= GameConstants.HOURS_PER_DAY) {
            hour -= GameConstants.HOURS_PER_DAY;
            day++;
            events.add(new TimeEvent(TimeEvent.Type.NEW_DAY, day, season));

            if (day > GameConstants.DAYS_PER_SEASON) {
                day = 1;
                season = season.next();
                events.add(new TimeEvent(TimeEvent.Type.NEW_SEASON, day, season));
            }
        }
        return events;
    }

    public boolean isNight() {
        return hour >= 20 || hour < 6;
    }

    public Season getSeason() { return season; }
    public int getDay() { return day; }
    public double getHour() { return hour; }
    public boolean isPaused() { return paused; }
    public void setPaused(boolean paused) { this.paused = paused; }
}
