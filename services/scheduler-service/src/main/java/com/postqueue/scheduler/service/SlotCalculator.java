package com.postqueue.scheduler.service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * "Next available slot" over a fixed set of daily publication times.
 * <p>
 * Pure: the current instant is always passed in. A slot falling exactly on {@code now}
 * (or on the chain tail) counts as already taken, so the following slot is returned.
 */
public class SlotCalculator {

    private final ZoneId zone;
    private final List<LocalTime> dailySlots;

    public SlotCalculator(ZoneId zone, Collection<LocalTime> dailySlots) {
        if (dailySlots == null || dailySlots.isEmpty()) {
            throw new IllegalArgumentException("At least one daily slot is required");
        }
        this.zone = Objects.requireNonNull(zone, "zone");
        this.dailySlots = List.copyOf(new TreeSet<>(dailySlots));
    }

    /**
     * @param chainTail latest scheduled time among the account's pending and processing posts, or null
     * @param now       the current instant
     * @return the earliest slot strictly after both the tail and {@code now}, in the slot zone's offset
     */
    public OffsetDateTime nextSlot(OffsetDateTime chainTail, OffsetDateTime now) {
        Objects.requireNonNull(now, "now");

        Instant after = now.toInstant();
        if (chainTail != null && chainTail.toInstant().isAfter(after)) {
            after = chainTail.toInstant();
        }

        LocalDate day = after.atZone(zone).toLocalDate();
        // tomorrow's first slot always qualifies
        for (int offset = 0; offset < 2; offset++) {
            for (LocalTime slot : dailySlots) {
                ZonedDateTime candidate = ZonedDateTime.of(day.plusDays(offset), slot, zone);
                if (candidate.toInstant().isAfter(after)) {
                    return candidate.toOffsetDateTime();
                }
            }
        }
        throw new IllegalStateException("No slot found after " + after);
    }

    public ZoneId getZone() {
        return zone;
    }

    public List<LocalTime> getDailySlots() {
        return dailySlots;
    }
}
