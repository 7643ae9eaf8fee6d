package com.forecastalpha.analysis.analytics;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Sampling interval implied by a sorted timestamp sequence: either a fixed duration, or a
 * calendar step of whole months (optionally anchored to month end).
 */
record Cadence(Duration step, int months, boolean monthEnd) {

    static final Cadence DAILY = fixed(Duration.ofDays(1));

    static Cadence fixed(Duration step) {
        return new Cadence(step, 0, false);
    }

    static Cadence monthly(int months, boolean monthEnd) {
        return new Cadence(null, months, monthEnd);
    }

    /**
     * Infers the cadence of an ascending sequence. Needs at least three timestamps and a perfectly
     * regular spacing; anything else is not inferable.
     */
    static Optional<Cadence> infer(List<LocalDateTime> sorted) {
        if (sorted.size() < 3) {
            return Optional.empty();
        }
        Duration first = Duration.between(sorted.get(0), sorted.get(1));
        boolean regular = !first.isZero() && !first.isNegative();
        for (int i = 2; i < sorted.size() && regular; i++) {
            regular = Duration.between(sorted.get(i - 1), sorted.get(i)).equals(first);
        }
        if (regular) {
            return Optional.of(fixed(first));
        }
        return inferMonthly(sorted);
    }

    private static Optional<Cadence> inferMonthly(List<LocalDateTime> sorted) {
        LocalDateTime anchor = sorted.get(0);
        long step = monthIndex(sorted.get(1)) - monthIndex(anchor);
        if (step <= 0) {
            return Optional.empty();
        }
        boolean sameDay = true;
        boolean monthEnd = true;
        for (int i = 0; i < sorted.size(); i++) {
            LocalDateTime current = sorted.get(i);
            if (!current.toLocalTime().equals(anchor.toLocalTime())) {
                return Optional.empty();
            }
            if (i > 0 && monthIndex(current) - monthIndex(sorted.get(i - 1)) != step) {
                return Optional.empty();
            }
            sameDay &= current.getDayOfMonth() == anchor.getDayOfMonth();
            monthEnd &= current.getDayOfMonth() == current.toLocalDate().lengthOfMonth();
        }
        if (sameDay) {
            return Optional.of(monthly((int) step, false));
        }
        return monthEnd ? Optional.of(monthly((int) step, true)) : Optional.empty();
    }

    /**
     * {@code count} timestamps strictly after {@code last}, one step apart.
     */
    List<LocalDateTime> after(LocalDateTime last, int count) {
        List<LocalDateTime> future = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            if (step != null) {
                future.add(last.plus(step.multipliedBy(i)));
            } else {
                LocalDateTime next = last.plusMonths((long) months * i);
                future.add(monthEnd ? next.with(TemporalAdjusters.lastDayOfMonth()) : next);
            }
        }
        return future;
    }

    private static long monthIndex(LocalDateTime value) {
        return value.getYear() * 12L + value.getMonthValue();
    }

    @Override
    public String toString() {
        if (step != null) {
            return step.toString();
        }
        return "P" + months + "M" + (monthEnd ? " (month end)" : "");
    }
}
