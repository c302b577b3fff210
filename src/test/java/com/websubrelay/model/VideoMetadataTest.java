package com.websubrelay.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VideoMetadataTest {

    @Test
    void parsesIsoDurations() {
        assertThat(VideoMetadata.parseDurationSeconds("PT15M33S")).isEqualTo(933);
        assertThat(VideoMetadata.parseDurationSeconds("PT1H")).isEqualTo(3600);
        assertThat(VideoMetadata.parseDurationSeconds("P1DT1S")).isEqualTo(86_401);
        assertThat(VideoMetadata.parseDurationSeconds("P0D")).isZero();
    }

    @Test
    void unparsableDurationCountsAsZero() {
        assertThat(VideoMetadata.parseDurationSeconds(null)).isZero();
        assertThat(VideoMetadata.parseDurationSeconds("")).isZero();
        assertThat(VideoMetadata.parseDurationSeconds("15 minutes")).isZero();
    }

    @Test
    void hdQualityNeedsDefinitionAndMaxresThumbnail() {
        assertThat(new VideoMetadata("public", "PT5M", "hd", null, null, true).meetsHdQuality()).isTrue();
        assertThat(new VideoMetadata("public", "PT5M", "hd", null, null, false).meetsHdQuality()).isFalse();
        assertThat(new VideoMetadata("public", "PT5M", "sd", null, null, true).meetsHdQuality()).isFalse();
    }

    @Test
    void onlyPublicIsVisible() {
        assertThat(new VideoMetadata("public", null, null, null, null, false).publiclyVisible()).isTrue();
        assertThat(new VideoMetadata("unlisted", null, null, null, null, false).publiclyVisible()).isFalse();
        assertThat(new VideoMetadata(null, null, null, null, null, false).publiclyVisible()).isFalse();
    }
}
