package io.github.hongjungwan.contextlog.starter.web;

import io.github.hongjungwan.contextlog.api.context.ContextRequest;
import jakarta.servlet.http.HttpServletRequest;

import java.util.Optional;

/**
 * Servlet 요청 기반 {@link ContextRequest}. 헤더 이름은 Servlet API 규약대로 대소문자 무시.
 */
public class ServletContextRequest implements ContextRequest {

    private final HttpServletRequest request;

    public ServletContextRequest(HttpServletRequest request) {
        this.request = request;
    }

    public HttpServletRequest getRequest() {
        return request;
    }

    @Override
    public Optional<String> header(String name) {
        return Optional.ofNullable(request.getHeader(name));
    }

    @Override
    public Optional<Object> attribute(String name) {
        return Optional.ofNullable(request.getAttribute(name));
    }

    @Override
    public void setAttribute(String name, Object value) {
        if (value == null) {
            request.removeAttribute(name);
        } else {
            request.setAttribute(name, value);
        }
    }
}
