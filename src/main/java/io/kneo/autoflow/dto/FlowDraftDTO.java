package io.kneo.autoflow.dto;

import io.kneo.autoflow.model.action.FlowAction;
import io.kneo.autoflow.model.cnst.TriggerType;
import io.kneo.autoflow.model.scheduler.Schedule;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Setter
@Getter
@NoArgsConstructor
public class FlowDraftDTO {
    @NotBlank
    private String name;
    private String nameHe;
    private String description;
    private String descriptionHe;
    @NotNull
    private List<FlowAction> actions = new ArrayList<>();
    private TriggerType triggerType = TriggerType.SCHEDULED;
    private Schedule schedule;
    private int priority;
    private boolean loop;
}
