package io.github.hongjungwan.contextlog.core.context.builtin;

import io.github.hongjungwan.contextlog.api.config.LogContextSettings;
import io.github.hongjungwan.contextlog.api.context.ContextRequest;
import io.github.hongjungwan.contextlog.api.context.ContextResponse;
import io.github.hongjungwan.contextlog.api.context.LogContextProvider;

/**
 * Distributed trace id. Read from and echoed on a configurable header.
 */
public class TraceIdContextProvider extends LogContextProvider<String> {

    public static final String NAME = "trace_id";

    private final String headerName;

    public TraceIdContextProvider() {
        this(LogContextSettings.DEFAULT_TRACE_ID_HEADER);
    }

    public TraceIdContextProvider(String headerName) {
        super(NAME, "-");
        this.headerName = headerName;
    }

    public String getHeaderName() {
        return headerName;
    }

    @Override
    public String extract(ContextRequest request) {
        return Identifiers.fromHeaderOrRandom(request, headerName);
    }

    @Override
    public void decorateResponse(ContextResponse response, String value) {
        response.setHeader(headerName, value);
    }
}
