package io.kneo.autoflow.service.external;

import io.smallrye.mutiny.Uni;

import java.util.Optional;

/**
 * Display enrichment only. A missing title never affects execution; callers show the raw id.
 */
public interface ContentLookup {

    Uni<Optional<String>> resolveContentTitle(String contentId);
}
