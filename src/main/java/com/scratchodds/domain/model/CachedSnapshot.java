package com.scratchodds.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * The last successful snapshot together with the time it was taken.
 */
public record CachedSnapshot(List<GameRecord> games, Instant timestamp) {

    /** Age after which a cached snapshot is flagged as stale to the user. */
    public static final Duration STALE_AFTER = Duration.ofHours(24);

    public CachedSnapshot {
        games = games == null ? List.of() : List.copyOf(games);
    }

    public boolean isStale(Instant now) {
        return Duration.between(timestamp, now).compareTo(STALE_AFTER) > 0;
    }

    /**
     * Human readable age such as "3 hours ago" or "just now".
     */
    public String describeAge(Instant now) {
        long hours = Duration.between(timestamp, now).toHours();
        long days = hours / 24;
        if (days > 0) {
            return days + " day" + (days > 1 ? "s" : "") + " ago";
        }
        if (hours > 0) {
            return hours + " hour" + (hours > 1 ? "s" : "") + " ago";
        }
        return "just now";
    }
}
