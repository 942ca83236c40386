package com.quantflow.live;

import com.quantflow.core.error.ConfigurationException;
import com.quantflow.core.model.Bar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Filter to keep live polling inside the trading session.
 * Session: Monday - Friday, {@code open} inclusive to {@code close} exclusive, in the configured zone.
 * Bars of a day or longer are only checked for falling on a weekday.
 */
public final class TradingSessionFilter {
    private static final Logger logger = LoggerFactory.getLogger(TradingSessionFilter.class);
    private static final Pattern TIMEFRAME = Pattern.compile("(\\d+)(Min|Hour|Day|Week|Month)");

    private final ZoneId zone;
    private final LocalTime open;
    private final LocalTime close;
    private final Duration barDuration;

    public TradingSessionFilter(ZoneId zone, LocalTime open, LocalTime close, Duration barDuration) {
        if (!open.isBefore(close)) {
            throw new ConfigurationException("Session open " + open + " must precede close " + close);
        }
        this.zone = zone;
        this.open = open;
        this.close = close;
        this.barDuration = barDuration;
        logger.info("Trading session {} - {} {} (Monday - Friday), bar length {}", open, close, zone, barDuration);
    }

    /**
     * Length of one bar for an Alpaca-style timeframe such as {@code 15Min}, {@code 1Hour} or {@code 1Day}.
     */
    public static Duration barDuration(String timeframe) {
        Matcher m = TIMEFRAME.matcher(timeframe);
        if (!m.matches()) {
            throw new ConfigurationException("Unsupported bar timeframe: " + timeframe);
        }
        long n = Long.parseLong(m.group(1));
        return switch (m.group(2)) {
            case "Min" -> Duration.ofMinutes(n);
            case "Hour" -> Duration.ofHours(n);
            case "Day" -> Duration.ofDays(n);
            case "Week" -> Duration.ofDays(7 * n);
            default -> Duration.ofDays(30 * n);
        };
    }

    public Duration barDuration() {
        return barDuration;
    }

    public boolean isIntraday() {
        return barDuration.compareTo(Duration.ofDays(1)) < 0;
    }

    /**
     * Check if {@code instant} falls within the session.
     */
    public boolean isSessionOpen(Instant instant) {
        ZonedDateTime local = instant.atZone(zone);
        if (!isWeekday(local.getDayOfWeek())) {
            return false;
        }
        LocalTime time = local.toLocalTime();
        return !time.isBefore(open) && time.isBefore(close);
    }

    public boolean accepts(Bar bar) {
        ZonedDateTime local = bar.timestamp().atZone(zone);
        if (!isWeekday(local.getDayOfWeek())) {
            return false;
        }
        return !isIntraday() || isSessionOpen(bar.timestamp());
    }

    /**
     * Whether a bar starting at {@code start} has closed by {@code now}.
     */
    public boolean isComplete(Instant start, Instant now) {
        return !start.plus(barDuration).isAfter(now);
    }

    private static boolean isWeekday(DayOfWeek day) {
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
    }
}
