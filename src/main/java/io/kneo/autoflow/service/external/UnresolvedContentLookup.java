package io.kneo.autoflow.service.external;

import io.quarkus.arc.DefaultBean;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Optional;

@DefaultBean
@ApplicationScoped
public class UnresolvedContentLookup implements ContentLookup {

    @Override
    public Uni<Optional<String>> resolveContentTitle(String contentId) {
        return Uni.createFrom().item(Optional.empty());
    }
}
