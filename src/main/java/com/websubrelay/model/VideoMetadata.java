package com.websubrelay.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.time.format.DateTimeParseException;

/**
 * Authoritative attributes of one video as reported by the content API.
 * {@code title}, {@code publishedAt} and {@code maxresThumbnail} are only
 * filled when extended fields were requested.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class VideoMetadata {

    public static final String PUBLIC = "public";
    public static final String HIGH_DEFINITION = "hd";

    private String privacyStatus;
    private String duration;
    private String definition;
    private String title;
    private String publishedAt;
    private boolean maxresThumbnail;

    public boolean publiclyVisible() {
        return PUBLIC.equals(privacyStatus);
    }

    public long durationSeconds() {
        return parseDurationSeconds(duration);
    }

    public boolean meetsHdQuality() {
        return HIGH_DEFINITION.equals(definition) && maxresThumbnail;
    }

    /**
     * Parses an ISO-8601 duration such as {@code PT15M33S} or {@code P0D}.
     * Missing or unparsable values count as zero seconds.
     */
    public static long parseDurationSeconds(String iso) {
        if (iso == null || iso.isBlank()) {
            return 0;
        }
        try {
            return Math.max(0, Duration.parse(iso.trim()).getSeconds());
        } catch (DateTimeParseException e) {
            return 0;
        }
    }
}
