package io.github.hongjungwan.contextlog.core.context.builtin;

import io.github.hongjungwan.contextlog.api.context.ContextRequest;
import io.github.hongjungwan.contextlog.api.context.ContextResponse;
import io.github.hongjungwan.contextlog.api.context.LogContextProvider;

/**
 * Correlation id shared by related requests. Taken from {@code X-Correlation-Id} or generated.
 */
public class CorrelationIdContextProvider extends LogContextProvider<String> {

    public static final String NAME = "correlation_id";
    public static final String HEADER = "X-Correlation-Id";

    public CorrelationIdContextProvider() {
        super(NAME, "-");
    }

    @Override
    public String extract(ContextRequest request) {
        return Identifiers.fromHeaderOrRandom(request, HEADER);
    }

    @Override
    public void decorateResponse(ContextResponse response, String value) {
        response.setHeader(HEADER, value);
    }
}
