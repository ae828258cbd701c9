package io.kneo.autoflow.dto;

import io.kneo.autoflow.model.action.FlowAction;
import io.kneo.autoflow.model.cnst.TriggerType;
import io.kneo.autoflow.model.scheduler.Schedule;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Partial update; null fields are left unchanged.
 */
@Setter
@Getter
@NoArgsConstructor
public class FlowPatchDTO {
    private String name;
    private String nameHe;
    private String description;
    private String descriptionHe;
    private List<FlowAction> actions;
    private TriggerType triggerType;
    private Schedule schedule;
    private Integer priority;
    private Boolean loop;
}
