package io.kneo.autoflow.service;

import io.kneo.autoflow.model.Flow;
import io.kneo.autoflow.model.action.FlowAction;
import io.kneo.autoflow.model.cnst.TriggerType;
import io.kneo.autoflow.service.scheduler.ScheduleValidator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.List;

/**
 * Whole-flow well-formedness: name, trigger, schedule and every action. Collects all problems.
 */
@ApplicationScoped
public class FlowValidator {
    static final String EMPTY_ACTIONS = "Flow must contain at least one action";

    private final ScheduleValidator scheduleValidator;

    @Inject
    public FlowValidator(ScheduleValidator scheduleValidator) {
        this.scheduleValidator = scheduleValidator;
    }

    public List<String> validate(Flow flow) {
        List<String> errors = new ArrayList<>();
        if (flow.getName() == null || flow.getName().isBlank()) {
            errors.add("Flow name is required");
        }
        errors.addAll(validateActions(flow.getActions()));
        if (flow.getTriggerType() == null) {
            errors.add("Trigger type is required");
        } else if (flow.getTriggerType() == TriggerType.SCHEDULED) {
            if (flow.getSchedule() == null) {
                errors.add("Scheduled flow requires a schedule");
            } else {
                scheduleValidator.validate(flow.getSchedule())
                        .forEach(error -> errors.add("Schedule: " + error));
            }
        } else if (flow.getSchedule() != null) {
            errors.add("Only scheduled flows carry a schedule");
        }
        return errors;
    }

    public List<String> validateActions(List<FlowAction> actions) {
        if (actions == null || actions.isEmpty()) {
            return List.of(EMPTY_ACTIONS);
        }
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < actions.size(); i++) {
            errors.addAll(validateAction(actions.get(i), i));
        }
        return errors;
    }

    public List<String> validateAction(FlowAction action, int index) {
        if (action == null) {
            return List.of(String.format("Action %d: missing", index + 1));
        }
        List<String> errors = new ArrayList<>();
        for (String error : action.validate()) {
            errors.add(String.format("Action %d (%s): %s", index + 1, action.type().getValue(), error));
        }
        return errors;
    }
}
