package io.github.hongjungwan.contextlog.starter.web;

import io.github.hongjungwan.contextlog.api.context.ContextResponse;
import jakarta.servlet.http.HttpServletResponse;

import java.util.Optional;

public class ServletContextResponse implements ContextResponse {

    private final HttpServletResponse response;

    public ServletContextResponse(HttpServletResponse response) {
        this.response = response;
    }

    @Override
    public void setHeader(String name, String value) {
        response.setHeader(name, value);
    }

    @Override
    public Optional<String> header(String name) {
        return Optional.ofNullable(response.getHeader(name));
    }
}
