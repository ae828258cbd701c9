package io.kneo.autoflow.service.external;

import io.kneo.autoflow.model.action.FlowAction;
import io.smallrye.mutiny.Uni;

import java.util.List;

/**
 * Turns free text ("play 3 happy songs then the 2 commercials") into action drafts.
 */
public interface FlowDescriptionParser {

    Uni<List<FlowAction>> parseDescription(String text);
}
