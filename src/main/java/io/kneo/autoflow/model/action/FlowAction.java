package io.kneo.autoflow.model.action;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Duration;
import java.util.List;

/**
 * A single broadcast action. Every variant derives its own timeline length and validates
 * its own required fields, so adding a variant does not compile until both are written.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PlayGenre.class, name = "play_genre"),
        @JsonSubTypes.Type(value = PlayContent.class, name = "play_content"),
        @JsonSubTypes.Type(value = PlayShow.class, name = "play_show"),
        @JsonSubTypes.Type(value = PlayCommercials.class, name = "play_commercials"),
        @JsonSubTypes.Type(value = PlayScheduledCommercials.class, name = "play_scheduled_commercials"),
        @JsonSubTypes.Type(value = PlayJingle.class, name = "play_jingle"),
        @JsonSubTypes.Type(value = Wait.class, name = "wait"),
        @JsonSubTypes.Type(value = SetVolume.class, name = "set_volume"),
        @JsonSubTypes.Type(value = FadeVolume.class, name = "fade_volume"),
        @JsonSubTypes.Type(value = Announcement.class, name = "announcement"),
        @JsonSubTypes.Type(value = TimeCheck.class, name = "time_check"),
        @JsonSubTypes.Type(value = GenerateJingle.class, name = "generate_jingle")
})
public sealed interface FlowAction permits PlayGenre, PlayContent, PlayShow, PlayCommercials,
        PlayScheduledCommercials, PlayJingle, Wait, SetVolume, FadeVolume, Announcement, TimeCheck, GenerateJingle {

    @JsonIgnore
    ActionType type();

    /**
     * Length of the action on the timeline. Never negative.
     */
    Duration estimateDuration(ActionDurationDefaults defaults);

    /**
     * Human-readable problems with the required fields of this variant; empty when valid.
     */
    List<String> validate();

    String description();

    @JsonIgnore
    default boolean isValid() {
        return validate().isEmpty();
    }

    static Duration seconds(long value) {
        return Duration.ofSeconds(Math.max(0, value));
    }
}
