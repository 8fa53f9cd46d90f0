package io.github.hongjungwan.contextlog.core.context.builtin;

import io.github.hongjungwan.contextlog.api.context.ContextRequest;

import java.util.UUID;

final class Identifiers {

    private Identifiers() {}

    /** Header value, or a random UUID when the header is missing or blank. */
    static String fromHeaderOrRandom(ContextRequest request, String header) {
        return request.header(header)
                .filter(s -> !s.isBlank())
                .orElseGet(() -> UUID.randomUUID().toString());
    }
}
