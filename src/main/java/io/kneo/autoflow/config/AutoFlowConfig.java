package io.kneo.autoflow.config;

import io.kneo.autoflow.model.cnst.OneTimeLoopPolicy;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.time.ZoneId;

@ConfigMapping(prefix = "autoflow")
public interface AutoFlowConfig {
    @WithName("planning-horizon-days")
    @WithDefault("90")
    int getPlanningHorizonDays();

    @WithName("time-zone")
    @WithDefault("UTC")
    ZoneId getTimeZone();

    @WithName("one-time-loop-policy")
    @WithDefault("REPEAT_WITHIN_WINDOW")
    OneTimeLoopPolicy getOneTimeLoopPolicy();

    @WithName("trigger.interval")
    @WithDefault("30s")
    Duration getTriggerInterval();

    @WithName("revalidation.cron")
    @WithDefault("0 30 3 * * ?")
    String getRevalidationCron();

    @WithName("preview.speed-up")
    @WithDefault("60")
    double getPreviewSpeedUp();

    @WithName("dispatch.address")
    @WithDefault("autoflow.dispatch")
    String getDispatchAddress();

    @WithName("duration")
    DurationEstimates getDuration();

    interface DurationEstimates {
        @WithName("seconds-per-song")
        @WithDefault("210")
        long getSecondsPerSong();

        @WithName("seconds-per-commercial")
        @WithDefault("30")
        long getSecondsPerCommercial();

        @WithName("commercial-block-seconds")
        @WithDefault("120")
        long getCommercialBlockSeconds();

        @WithName("content-seconds")
        @WithDefault("180")
        long getContentSeconds();

        @WithName("jingle-seconds")
        @WithDefault("15")
        long getJingleSeconds();

        @WithName("set-volume-seconds")
        @WithDefault("1")
        long getSetVolumeSeconds();

        @WithName("announcement-min-seconds")
        @WithDefault("10")
        long getAnnouncementMinSeconds();

        @WithName("time-check-seconds")
        @WithDefault("5")
        long getTimeCheckSeconds();

        @WithName("generated-jingle-seconds")
        @WithDefault("15")
        long getGeneratedJingleSeconds();
    }
}
