package io.kneo.autoflow.server;

import io.kneo.autoflow.config.AutoFlowConfig;
import io.kneo.autoflow.controller.FlowController;
import io.quarkus.runtime.StartupEvent;
import io.vertx.ext.web.Route;
import io.vertx.ext.web.Router;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@ApplicationScoped
public class AutoFlowApplicationInit {
    private static final Logger LOGGER = LoggerFactory.getLogger(AutoFlowApplicationInit.class);

    @Inject
    FlowController flowController;

    @Inject
    AutoFlowConfig config;

    @Inject
    protected Router router;

    public void onStart(@Observes StartupEvent ev) {
        flowController.setupRoutes(router);
        logRegisteredRoutes(router);
        LOGGER.info("AutoFlow started: zone {}, planning horizon {} days, trigger interval {}, revalidation '{}', one-time loop policy {}",
                config.getTimeZone(), config.getPlanningHorizonDays(), config.getTriggerInterval(),
                config.getRevalidationCron(), config.getOneTimeLoopPolicy());
    }

    private void logRegisteredRoutes(Router router) {
        for (Route route : router.getRoutes()) {
            if (route.getPath() != null) {
                LOGGER.debug("Route {} {}", route.methods() == null ? "*" : route.methods(), route.getPath());
            }
        }
    }
}
