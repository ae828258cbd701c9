package io.kneo.autoflow.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.kneo.autoflow.model.action.FlowAction;
import io.kneo.autoflow.model.cnst.FlowStatus;
import io.kneo.autoflow.model.cnst.TriggerType;
import io.kneo.autoflow.model.scheduler.Schedule;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Flow {
    private UUID id;
    private String name;
    private String nameHe;
    private String description;
    private String descriptionHe;
    private List<FlowAction> actions = new ArrayList<>();
    private TriggerType triggerType = TriggerType.SCHEDULED;
    private Schedule schedule;
    private FlowStatus status = FlowStatus.ACTIVE;
    private int priority;
    private boolean loop;
    private int runCount;
    private Instant lastRun;
    private Instant createdAt;
    private Instant updatedAt;

    @JsonIgnore
    public boolean isScheduled() {
        return triggerType == TriggerType.SCHEDULED && schedule != null;
    }

    @JsonIgnore
    public boolean isRunning() {
        return status == FlowStatus.RUNNING;
    }

    public Flow copy() {
        Flow copy = new Flow();
        copy.setId(id);
        copy.setName(name);
        copy.setNameHe(nameHe);
        copy.setDescription(description);
        copy.setDescriptionHe(descriptionHe);
        copy.setActions(actions == null ? new ArrayList<>() : new ArrayList<>(actions));
        copy.setTriggerType(triggerType);
        copy.setSchedule(schedule == null ? null : schedule.copy());
        copy.setStatus(status);
        copy.setPriority(priority);
        copy.setLoop(loop);
        copy.setRunCount(runCount);
        copy.setLastRun(lastRun);
        copy.setCreatedAt(createdAt);
        copy.setUpdatedAt(updatedAt);
        return copy;
    }
}
