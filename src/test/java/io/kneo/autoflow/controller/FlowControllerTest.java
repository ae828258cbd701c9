package io.kneo.autoflow.controller;

import io.kneo.autoflow.service.FlowService;
import io.quarkus.test.common.http.TestHTTPResource;
import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.junit.TestProfile;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URL;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@QuarkusTest
@TestProfile(FlowTestProfile.class)
class FlowControllerTest {

    @TestHTTPResource("/api/flows")
    URL flowsUrl;

    @Inject
    Vertx vertx;

    @Inject
    FlowService flowService;

    private WebClient client;

    @BeforeEach
    void setUp() {
        client = WebClient.create(vertx);
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    @Test
    void testCreate_ConflictingCopyGets409() {
        JsonObject draft = weeklyDraft("Monday drive time", 1);

        HttpResponse<Buffer> created = client.postAbs(flowsUrl.toString()).sendJsonObjectAndAwait(draft);
        assertEquals(201, created.statusCode());
        String id = created.bodyAsJsonObject().getString("id");
        assertNotNull(id);
        assertEquals("active", created.bodyAsJsonObject().getString("status"));

        HttpResponse<Buffer> rejected = client.postAbs(flowsUrl.toString())
                .sendJsonObjectAndAwait(weeklyDraft("Monday copy", 1));
        assertEquals(409, rejected.statusCode());
        JsonArray conflicts = rejected.bodyAsJsonObject().getJsonArray("conflicts");
        assertEquals(1, conflicts.size());
        assertEquals(id, conflicts.getJsonObject(0).getString("flowId"));

        HttpResponse<Buffer> forced = client.postAbs(flowsUrl.toString())
                .addQueryParam("force", "true")
                .sendJsonObjectAndAwait(weeklyDraft("Monday forced", 1));
        assertEquals(201, forced.statusCode());
        assertEquals("disabled", forced.bodyAsJsonObject().getString("status"));
    }

    @Test
    void testCreate_ValidationErrorsListed() {
        JsonObject draft = weeklyDraft("No actions", 2).put("actions", new JsonArray());

        HttpResponse<Buffer> response = client.postAbs(flowsUrl.toString()).sendJsonObjectAndAwait(draft);

        assertEquals(400, response.statusCode());
        assertEquals("validation", response.bodyAsJsonObject().getString("error"));
        assertTrue(response.bodyAsJsonObject().getJsonArray("errors").contains("Flow must contain at least one action"));
    }

    @Test
    void testCheckConflicts_DoesNotSave() {
        int before = flowService.list().await().indefinitely().size();

        HttpResponse<Buffer> response = client.postAbs(flowsUrl + "/check-conflicts")
                .sendJsonObjectAndAwait(weeklyDraft("Dry check", 3));

        assertEquals(200, response.statusCode());
        assertEquals("No conflicts", response.bodyAsJsonObject().getString("message"));
        assertEquals(before, flowService.list().await().indefinitely().size());
    }

    @Test
    void testManualFlow_RunStopAndTimeline() {
        JsonObject draft = new JsonObject()
                .put("name", "Request hour")
                .put("triggerType", "manual")
                .put("loop", true)
                .put("actions", new JsonArray()
                        .add(new JsonObject().put("type", "play_genre").put("genre", "happy").put("durationMinutes", 30))
                        .add(new JsonObject().put("type", "play_jingle").put("jingleId", "station-id")));
        String id = client.postAbs(flowsUrl.toString()).sendJsonObjectAndAwait(draft)
                .bodyAsJsonObject().getString("id");

        HttpResponse<Buffer> timeline = client.getAbs(flowsUrl + "/" + id + "/timeline").sendAndAwait();
        assertEquals(200, timeline.statusCode());
        assertEquals(2, timeline.bodyAsJsonObject().getJsonArray("segments").size());

        HttpResponse<Buffer> run = client.postAbs(flowsUrl + "/" + id + "/run").sendAndAwait();
        assertEquals(202, run.statusCode());
        assertEquals("running", run.bodyAsJsonObject().getString("status"));

        HttpResponse<Buffer> edit = client.deleteAbs(flowsUrl + "/" + id + "/actions/1").sendAndAwait();
        assertEquals(409, edit.statusCode());
        assertEquals("running", edit.bodyAsJsonObject().getString("status"));

        HttpResponse<Buffer> stop = client.postAbs(flowsUrl + "/" + id + "/stop").sendAndAwait();
        assertEquals(200, stop.statusCode());
        assertEquals("cancelled", stop.bodyAsJsonObject().getString("status"));

        HttpResponse<Buffer> executions = client.getAbs(flowsUrl + "/" + id + "/executions").sendAndAwait();
        assertEquals(1, executions.bodyAsJsonArray().size());
    }

    @Test
    void testUpcoming_DaysCappedAtPlanningHorizon() {
        String id = client.postAbs(flowsUrl.toString()).sendJsonObjectAndAwait(weeklyDraft("Thursday drive time", 4))
                .bodyAsJsonObject().getString("id");
        String upcomingUrl = flowsUrl + "/" + id + "/upcoming";

        HttpResponse<Buffer> week = client.getAbs(upcomingUrl).addQueryParam("days", "7").sendAndAwait();
        assertEquals(200, week.statusCode());
        assertTrue(week.bodyAsJsonArray().size() >= 1);

        HttpResponse<Buffer> horizon = client.getAbs(upcomingUrl).addQueryParam("days", "30").sendAndAwait();
        assertEquals(200, horizon.statusCode());

        HttpResponse<Buffer> beyond = client.getAbs(upcomingUrl).addQueryParam("days", "31").sendAndAwait();
        assertEquals(400, beyond.statusCode());

        HttpResponse<Buffer> huge = client.getAbs(upcomingUrl).addQueryParam("days", String.valueOf(Integer.MAX_VALUE))
                .sendAndAwait();
        assertEquals(400, huge.statusCode());
    }

    @Test
    void testUnknownFlow_NotFound() {
        HttpResponse<Buffer> response = client.getAbs(flowsUrl + "/" + UUID.randomUUID()).sendAndAwait();

        assertEquals(404, response.statusCode());
    }

    private static JsonObject weeklyDraft(String name, int day) {
        return new JsonObject()
                .put("name", name)
                .put("actions", new JsonArray()
                        .add(new JsonObject().put("type", "play_genre").put("genre", "happy").put("durationMinutes", 45))
                        .add(new JsonObject().put("type", "play_commercials").put("count", 2)))
                .put("schedule", new JsonObject()
                        .put("recurrence", "weekly")
                        .put("daysOfWeek", new JsonArray().add(day))
                        .put("startTime", "08:00")
                        .put("endTime", "10:00"));
    }
}
