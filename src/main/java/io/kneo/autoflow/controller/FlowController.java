package io.kneo.autoflow.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kneo.autoflow.config.AutoFlowConfig;
import io.kneo.autoflow.dto.ConflictReportDTO;
import io.kneo.autoflow.dto.FlowDraftDTO;
import io.kneo.autoflow.dto.FlowPatchDTO;
import io.kneo.autoflow.model.action.FlowAction;
import io.kneo.autoflow.model.cnst.ExecutionMode;
import io.kneo.autoflow.model.cnst.RunTrigger;
import io.kneo.autoflow.service.FlowPreviewService;
import io.kneo.autoflow.service.FlowRunner;
import io.kneo.autoflow.service.FlowService;
import io.kneo.autoflow.service.exceptions.FlowConflictException;
import io.kneo.autoflow.service.exceptions.FlowNotFoundException;
import io.kneo.autoflow.service.exceptions.FlowValidationException;
import io.kneo.autoflow.service.exceptions.InvalidFlowStateException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@ApplicationScoped
public class FlowController {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlowController.class);
    private static final int DEFAULT_EXECUTIONS_LIMIT = 20;
    private static final int DEFAULT_UPCOMING_DAYS = 7;

    private final FlowService flowService;
    private final FlowRunner flowRunner;
    private final FlowPreviewService previewService;
    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final AutoFlowConfig config;
    private final Clock clock;

    @Inject
    public FlowController(FlowService flowService,
                          FlowRunner flowRunner,
                          FlowPreviewService previewService,
                          ObjectMapper objectMapper,
                          Validator validator,
                          AutoFlowConfig config,
                          Clock clock) {
        this.flowService = flowService;
        this.flowRunner = flowRunner;
        this.previewService = previewService;
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.config = config;
        this.clock = clock;
    }

    public void setupRoutes(Router router) {
        String path = "/api/flows";
        router.route(path + "*").handler(BodyHandler.create());
        router.get(path).handler(this::getAll);
        router.get(path + "/active").handler(this::getActive);
        router.post(path + "/check-conflicts").handler(this::checkConflicts);
        router.post(path + "/parse-natural").handler(this::parseNatural);
        router.post(path).handler(this::create);
        router.get(path + "/:id").handler(this::getById);
        router.put(path + "/:id").handler(this::update);
        router.delete(path + "/:id").handler(this::delete);
        router.post(path + "/:id/toggle").handler(this::toggle);
        router.post(path + "/:id/reset").handler(this::reset);
        router.post(path + "/:id/run").handler(this::run);
        router.post(path + "/:id/stop").handler(this::stop);
        router.get(path + "/:id/executions").handler(this::getExecutions);
        router.get(path + "/:id/upcoming").handler(this::getUpcoming);
        router.get(path + "/:id/timeline").handler(this::getTimeline);
        router.post(path + "/:id/actions/reorder").handler(this::reorderActions);
        router.post(path + "/:id/actions").handler(this::addAction);
        router.delete(path + "/:id/actions/:index").handler(this::removeAction);
    }

    private void getAll(RoutingContext rc) {
        flowService.list()
                .subscribe().with(flows -> sendJson(rc, 200, flows), e -> handleFailure(rc, e));
    }

    private void getActive(RoutingContext rc) {
        flowService.listActive()
                .subscribe().with(flows -> sendJson(rc, 200, flows), e -> handleFailure(rc, e));
    }

    private void getById(RoutingContext rc) {
        UUID id = flowId(rc);
        if (id == null) return;
        flowService.get(id)
                .subscribe().with(flow -> sendJson(rc, 200, flow), e -> handleFailure(rc, e));
    }

    private void create(RoutingContext rc) {
        FlowDraftDTO dto = readBody(rc, FlowDraftDTO.class);
        if (dto == null || !validateDTO(rc, dto)) return;
        flowService.create(dto, flag(rc, "force"), mode(rc))
                .subscribe().with(flow -> sendJson(rc, 201, flow), e -> handleFailure(rc, e));
    }

    private void update(RoutingContext rc) {
        UUID id = flowId(rc);
        if (id == null) return;
        FlowPatchDTO dto = readBody(rc, FlowPatchDTO.class);
        if (dto == null) return;
        flowService.update(id, dto, flag(rc, "force"), mode(rc))
                .subscribe().with(flow -> sendJson(rc, 200, flow), e -> handleFailure(rc, e));
    }

    private void delete(RoutingContext rc) {
        UUID id = flowId(rc);
        if (id == null) return;
        flowService.delete(id)
                .subscribe().with(
                        count -> rc.response().setStatusCode(count > 0 ? 204 : 404).end(),
                        e -> handleFailure(rc, e)
                );
    }

    private void toggle(RoutingContext rc) {
        UUID id = flowId(rc);
        if (id == null) return;
        flowService.toggle(id)
                .subscribe().with(flow -> sendJson(rc, 200, flow), e -> handleFailure(rc, e));
    }

    private void reset(RoutingContext rc) {
        UUID id = flowId(rc);
        if (id == null) return;
        flowService.resetStuck(id)
                .subscribe().with(flow -> sendJson(rc, 200, flow), e -> handleFailure(rc, e));
    }

    private void run(RoutingContext rc) {
        UUID id = flowId(rc);
        if (id == null) return;
        flowRunner.run(id, RunTrigger.MANUAL, mode(rc))
                .subscribe().with(execution -> sendJson(rc, 202, execution), e -> handleFailure(rc, e));
    }

    private void stop(RoutingContext rc) {
        UUID id = flowId(rc);
        if (id == null) return;
        flowRunner.stop(id)
                .subscribe().with(execution -> sendJson(rc, 200, execution), e -> handleFailure(rc, e));
    }

    private void getExecutions(RoutingContext rc) {
        UUID id = flowId(rc);
        if (id == null) return;
        Integer limit = intParam(rc, "limit", DEFAULT_EXECUTIONS_LIMIT);
        if (limit == null) return;
        flowService.executions(id, limit)
                .subscribe().with(executions -> sendJson(rc, 200, executions), e -> handleFailure(rc, e));
    }

    private void getUpcoming(RoutingContext rc) {
        UUID id = flowId(rc);
        if (id == null) return;
        Integer days = intParam(rc, "days", DEFAULT_UPCOMING_DAYS);
        if (days == null) return;
        if (days < 1) {
            rc.fail(400, new IllegalArgumentException("days must be positive"));
            return;
        }
        if (days > config.getPlanningHorizonDays()) {
            rc.fail(400, new IllegalArgumentException(
                    "days cannot exceed the planning horizon of " + config.getPlanningHorizonDays()));
            return;
        }
        Instant from = clock.instant();
        flowService.upcoming(id, from, from.plus(Duration.ofDays(days)))
                .subscribe().with(occurrences -> sendJson(rc, 200, occurrences), e -> handleFailure(rc, e));
    }

    private void getTimeline(RoutingContext rc) {
        UUID id = flowId(rc);
        if (id == null) return;
        previewService.timeline(id)
                .subscribe().with(timeline -> sendJson(rc, 200, timeline), e -> handleFailure(rc, e));
    }

    private void addAction(RoutingContext rc) {
        UUID id = flowId(rc);
        if (id == null) return;
        FlowAction action = readBody(rc, FlowAction.class);
        if (action == null) return;
        String at = rc.request().getParam("at");
        Integer index;
        try {
            index = at == null ? null : Integer.valueOf(at);
        } catch (NumberFormatException e) {
            rc.fail(400, new IllegalArgumentException("Invalid 'at' parameter: " + at));
            return;
        }
        flowService.addAction(id, action, index)
                .subscribe().with(flow -> sendJson(rc, 200, flow), e -> handleFailure(rc, e));
    }

    private void removeAction(RoutingContext rc) {
        UUID id = flowId(rc);
        if (id == null) return;
        int index;
        try {
            index = Integer.parseInt(rc.pathParam("index"));
        } catch (NumberFormatException e) {
            rc.fail(400, new IllegalArgumentException("Invalid action index"));
            return;
        }
        flowService.removeAction(id, index)
                .subscribe().with(flow -> sendJson(rc, 200, flow), e -> handleFailure(rc, e));
    }

    private void reorderActions(RoutingContext rc) {
        UUID id = flowId(rc);
        if (id == null) return;
        Integer from = intParam(rc, "from", null);
        Integer to = intParam(rc, "to", null);
        if (from == null || to == null) {
            if (!rc.failed()) {
                rc.fail(400, new IllegalArgumentException("'from' and 'to' are required"));
            }
            return;
        }
        flowService.reorderActions(id, from, to)
                .subscribe().with(flow -> sendJson(rc, 200, flow), e -> handleFailure(rc, e));
    }

    private void checkConflicts(RoutingContext rc) {
        FlowDraftDTO dto = readBody(rc, FlowDraftDTO.class);
        if (dto == null) return;
        String exclude = rc.request().getParam("excludeId");
        UUID excludeId;
        try {
            excludeId = exclude == null ? null : UUID.fromString(exclude);
        } catch (IllegalArgumentException e) {
            rc.fail(400, new IllegalArgumentException("Invalid excludeId"));
            return;
        }
        flowService.checkConflicts(dto, excludeId)
                .subscribe().with(
                        conflicts -> sendJson(rc, 200, new ConflictReportDTO(
                                conflicts.isEmpty() ? "No conflicts" : conflicts.size() + " conflicting flow(s)", conflicts)),
                        e -> handleFailure(rc, e)
                );
    }

    private void parseNatural(RoutingContext rc) {
        JsonObject body;
        try {
            body = rc.body().asJsonObject();
        } catch (RuntimeException e) {
            rc.fail(400, new IllegalArgumentException("Invalid JSON payload"));
            return;
        }
        String text = body == null ? null : body.getString("text");
        flowService.parseDescription(text)
                .subscribe().with(actions -> sendJson(rc, 200, actions), e -> handleFailure(rc, e));
    }

    private void handleFailure(RoutingContext rc, Throwable throwable) {
        if (throwable instanceof FlowValidationException e) {
            sendJson(rc, 400, new JsonObject()
                    .put("error", "validation")
                    .put("errors", new JsonArray(e.getErrors())));
        } else if (throwable instanceof FlowNotFoundException e) {
            sendJson(rc, 404, new JsonObject()
                    .put("error", "not_found")
                    .put("message", e.getDeveloperMessage()));
        } else if (throwable instanceof FlowConflictException e) {
            sendJson(rc, 409, new ConflictReportDTO(e.getDeveloperMessage(), e.getConflicts()));
        } else if (throwable instanceof InvalidFlowStateException e) {
            sendJson(rc, 409, new JsonObject()
                    .put("error", "invalid_state")
                    .put("status", e.getStatus().getValue())
                    .put("message", e.getDeveloperMessage()));
        } else if (throwable instanceof IllegalArgumentException) {
            rc.fail(400, throwable);
        } else {
            LOGGER.error("Unexpected failure on {} {}", rc.request().method(), rc.request().path(), throwable);
            rc.fail(500, throwable);
        }
    }

    private <T> T readBody(RoutingContext rc, Class<T> type) {
        String body = rc.body() == null ? null : rc.body().asString();
        if (body == null || body.isBlank()) {
            rc.fail(400, new IllegalArgumentException("Request body is required"));
            return null;
        }
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            LOGGER.debug("Rejected payload: {}", e.getOriginalMessage());
            rc.fail(400, new IllegalArgumentException("Invalid JSON payload: " + e.getOriginalMessage()));
            return null;
        }
    }

    private <T> boolean validateDTO(RoutingContext rc, T dto) {
        Set<ConstraintViolation<T>> violations = validator.validate(dto);
        if (violations.isEmpty()) {
            return true;
        }
        List<String> errors = violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted()
                .toList();
        handleFailure(rc, new FlowValidationException(errors));
        return false;
    }

    private void sendJson(RoutingContext rc, int status, Object payload) {
        String encoded;
        if (payload instanceof JsonObject json) {
            encoded = json.encode();
        } else {
            try {
                encoded = objectMapper.writeValueAsString(payload);
            } catch (JsonProcessingException e) {
                LOGGER.error("Cannot serialize response", e);
                rc.fail(500, e);
                return;
            }
        }
        rc.response()
                .setStatusCode(status)
                .putHeader("Content-Type", "application/json")
                .end(encoded);
    }

    private UUID flowId(RoutingContext rc) {
        try {
            return UUID.fromString(rc.pathParam("id"));
        } catch (IllegalArgumentException e) {
            rc.fail(400, new IllegalArgumentException("Invalid flow ID format"));
            return null;
        }
    }

    private Integer intParam(RoutingContext rc, String name, Integer defaultValue) {
        String value = rc.request().getParam(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            rc.fail(400, new IllegalArgumentException("Invalid '" + name + "' parameter: " + value));
            return null;
        }
    }

    private static boolean flag(RoutingContext rc, String name) {
        return Boolean.parseBoolean(rc.request().getParam(name, "false"));
    }

    private static ExecutionMode mode(RoutingContext rc) {
        return flag(rc, "dryRun") ? ExecutionMode.DRY_RUN : ExecutionMode.LIVE;
    }
}
