package io.github.hongjungwan.contextlog.core.context.builtin;

import io.github.hongjungwan.contextlog.api.context.ContextRequest;
import io.github.hongjungwan.contextlog.api.context.ContextResponse;
import io.github.hongjungwan.contextlog.api.context.LogContextProvider;

/**
 * Id of a single request. Taken from {@code X-Request-Id} or generated.
 */
public class RequestIdContextProvider extends LogContextProvider<String> {

    public static final String NAME = "request_id";
    public static final String HEADER = "X-Request-Id";

    public RequestIdContextProvider() {
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
