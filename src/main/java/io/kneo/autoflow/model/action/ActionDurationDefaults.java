package io.kneo.autoflow.model.action;

import io.kneo.autoflow.config.AutoFlowConfig;

/**
 * Estimates (seconds) used when an action carries no explicit length.
 */
public record ActionDurationDefaults(long secondsPerSong,
                                     long secondsPerCommercial,
                                     long commercialBlockSeconds,
                                     long contentSeconds,
                                     long jingleSeconds,
                                     long setVolumeSeconds,
                                     long announcementMinSeconds,
                                     long timeCheckSeconds,
                                     long generatedJingleSeconds) {

    public static ActionDurationDefaults standard() {
        return new ActionDurationDefaults(210, 30, 120, 180, 15, 1, 10, 5, 15);
    }

    public static ActionDurationDefaults from(AutoFlowConfig.DurationEstimates estimates) {
        return new ActionDurationDefaults(
                estimates.getSecondsPerSong(),
                estimates.getSecondsPerCommercial(),
                estimates.getCommercialBlockSeconds(),
                estimates.getContentSeconds(),
                estimates.getJingleSeconds(),
                estimates.getSetVolumeSeconds(),
                estimates.getAnnouncementMinSeconds(),
                estimates.getTimeCheckSeconds(),
                estimates.getGeneratedJingleSeconds()
        );
    }
}
