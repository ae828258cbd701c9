package io.kneo.autoflow.controller;

import io.quarkus.test.junit.QuarkusTestProfile;

import java.util.Map;

public class FlowTestProfile implements QuarkusTestProfile {
    @Override
    public Map<String, String> getConfigOverrides() {
        return Map.of(
                "autoflow.planning-horizon-days", "30",
                "autoflow.preview.speed-up", "3600"
        );
    }
}
