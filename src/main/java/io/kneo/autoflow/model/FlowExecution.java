package io.kneo.autoflow.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.kneo.autoflow.model.cnst.ExecutionStatus;
import io.kneo.autoflow.model.cnst.RunTrigger;
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
public class FlowExecution {
    private UUID id;
    private UUID flowId;
    private String flowName;
    private Instant startedAt;
    private Instant endedAt;
    private ExecutionStatus status = ExecutionStatus.RUNNING;
    private int actionsCompleted;
    private int totalActions;
    private String errorMessage;
    private RunTrigger triggeredBy;
    private boolean dryRun;
    private List<ActionFailure> failures = new ArrayList<>();

    public record ActionFailure(int index, int cycle, String actionType, String reason, Instant occurredAt) {
    }

    public FlowExecution copy() {
        FlowExecution copy = new FlowExecution();
        copy.setId(id);
        copy.setFlowId(flowId);
        copy.setFlowName(flowName);
        copy.setStartedAt(startedAt);
        copy.setEndedAt(endedAt);
        copy.setStatus(status);
        copy.setActionsCompleted(actionsCompleted);
        copy.setTotalActions(totalActions);
        copy.setErrorMessage(errorMessage);
        copy.setTriggeredBy(triggeredBy);
        copy.setDryRun(dryRun);
        copy.setFailures(new ArrayList<>(failures));
        return copy;
    }
}
