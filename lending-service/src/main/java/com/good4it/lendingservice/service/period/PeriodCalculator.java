package com.good4it.lendingservice.service.period;

import com.good4it.lendingservice.model.EmiFrequency;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// Keys: weekly 2024-W05 (ISO week), monthly 2024-01, quarterly Q1 2024
public class PeriodCalculator {

    private static final Pattern WEEK_KEY = Pattern.compile("(\\d{4})-W(\\d{2})");
    private static final Pattern QUARTER_KEY = Pattern.compile("Q([1-4]) (\\d{4})");

    private final ZoneId zone;

    public PeriodCalculator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public ZoneId zone() {
        return zone;
    }

    public Period periodContaining(EmiFrequency frequency, Instant instant) {
        return periodContaining(frequency, LocalDate.ofInstant(instant, zone));
    }

    public Period periodOfMonth(EmiFrequency frequency, YearMonth month) {
        if (frequency == EmiFrequency.MONTHLY) {
            return monthly(month);
        }
        return periodContaining(frequency, month.atDay(1));
    }

    public Period periodForKey(EmiFrequency frequency, String key) {
        return switch (frequency) {
            case WEEKLY -> weekly(parseWeekStart(key));
            case MONTHLY -> monthly(parseMonth(key));
            case QUARTERLY -> quarterly(parseQuarterStart(key));
        };
    }

    public Instant nextPeriodStart(EmiFrequency frequency, String key) {
        return periodForKey(frequency, key).endExclusive();
    }

    public String monthKey(Instant instant) {
        return YearMonth.from(LocalDate.ofInstant(instant, zone)).toString();
    }

    private Period periodContaining(EmiFrequency frequency, LocalDate date) {
        return switch (frequency) {
            case WEEKLY -> weekly(date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)));
            case MONTHLY -> monthly(YearMonth.from(date));
            case QUARTERLY -> quarterly(LocalDate.of(date.getYear(), firstMonthOfQuarter(date.getMonthValue()), 1));
        };
    }

    private Period weekly(LocalDate monday) {
        String key = String.format("%d-W%02d",
                monday.get(IsoFields.WEEK_BASED_YEAR),
                monday.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
        return new Period(EmiFrequency.WEEKLY, key, startOf(monday), startOf(monday.plusWeeks(1)));
    }

    private Period monthly(YearMonth month) {
        return new Period(EmiFrequency.MONTHLY, month.toString(),
                startOf(month.atDay(1)), startOf(month.plusMonths(1).atDay(1)));
    }

    private Period quarterly(LocalDate quarterStart) {
        int quarter = (quarterStart.getMonthValue() - 1) / 3 + 1;
        String key = "Q" + quarter + " " + quarterStart.getYear();
        return new Period(EmiFrequency.QUARTERLY, key, startOf(quarterStart), startOf(quarterStart.plusMonths(3)));
    }

    private Instant startOf(LocalDate date) {
        return date.atStartOfDay(zone).toInstant();
    }

    private static int firstMonthOfQuarter(int month) {
        return ((month - 1) / 3) * 3 + 1;
    }

    private static LocalDate parseWeekStart(String key) {
        Matcher m = WEEK_KEY.matcher(key == null ? "" : key);
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid weekly period key: " + key);
        }
        int year = Integer.parseInt(m.group(1));
        int week = Integer.parseInt(m.group(2));
        // 4 January is always in ISO week 1
        LocalDate anchor = LocalDate.of(year, 1, 4);
        if (week < 1 || week > anchor.range(IsoFields.WEEK_OF_WEEK_BASED_YEAR).getMaximum()) {
            throw new IllegalArgumentException("Invalid weekly period key: " + key);
        }
        return anchor.with(IsoFields.WEEK_OF_WEEK_BASED_YEAR, week)
                .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    private static YearMonth parseMonth(String key) {
        try {
            return YearMonth.parse(key);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid monthly period key: " + key, e);
        }
    }

    private static LocalDate parseQuarterStart(String key) {
        Matcher m = QUARTER_KEY.matcher(key == null ? "" : key);
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid quarterly period key: " + key);
        }
        int quarter = Integer.parseInt(m.group(1));
        return LocalDate.of(Integer.parseInt(m.group(2)), (quarter - 1) * 3 + 1, 1);
    }
}
