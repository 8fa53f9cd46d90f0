package io.github.hongjungwan.contextlog.starter.web;

import io.github.hongjungwan.contextlog.core.context.ContextMiddlewareChain;
import io.github.hongjungwan.contextlog.core.context.LogContextRegistry;
import io.github.hongjungwan.contextlog.core.context.builtin.UserIdContextProvider;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.security.Principal;

/**
 * 요청마다 log context middleware chain을 실행하는 Servlet filter.
 *
 * <p>응답 본문을 버퍼링하여 downstream 처리 후에도 context 헤더를 기록할 수 있게 한다.
 * 비동기 요청은 AsyncContext 완료 시점에 본문을 복사하고 access 로그를 남긴다.</p>
 */
public class LogContextServletFilter extends OncePerRequestFilter {

    private final LogContextRegistry registry;
    private final ContextMiddlewareChain chain;
    private final Logger accessLog;
    private final boolean accessLogEnabled;

    public LogContextServletFilter(LogContextRegistry registry, Logger accessLog, boolean accessLogEnabled) {
        this.registry = registry;
        this.chain = registry.createMiddlewareChain();
        this.accessLog = accessLog;
        this.accessLogEnabled = accessLogEnabled;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        exposeAuthenticatedUser(request);
        ContentCachingResponseWrapper wrapper = new ContentCachingResponseWrapper(response);

        try {
            chain.execute(new ServletContextRequest(request), contextRequest -> {
                filterChain.doFilter(request, wrapper);
                if (request.isAsyncStarted()) {
                    // context 값은 지금 바인딩된 상태 그대로 완료 시점 로그에 전달
                    request.getAsyncContext().addListener(
                            new AsyncCompletionListener(wrapper, registry.wrap(() -> logAccess(request, wrapper))));
                } else {
                    logAccess(request, wrapper);
                }
                return new ServletContextResponse(wrapper);
            });
        } catch (IOException | ServletException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ServletException(e);
        } finally {
            if (!request.isAsyncStarted()) {
                wrapper.copyBodyToResponse();
            }
        }
    }

    /** 인증 단계가 user_id 속성을 남기지 않았으면 인증된 principal 이름을 사용 */
    private static void exposeAuthenticatedUser(HttpServletRequest request) {
        if (request.getAttribute(UserIdContextProvider.NAME) != null) {
            return;
        }
        Principal principal = request.getUserPrincipal();
        if (principal != null && principal.getName() != null && !principal.getName().isBlank()) {
            request.setAttribute(UserIdContextProvider.NAME, principal.getName());
        }
    }

    private void logAccess(HttpServletRequest request, HttpServletResponse response) {
        if (accessLogEnabled) {
            accessLog.info("{} {} {}", request.getMethod(), request.getRequestURI(), response.getStatus());
        }
    }

    /**
     * 비동기 요청 완료 시 access 로그 기록 및 버퍼링된 본문 복사.
     */
    private static class AsyncCompletionListener implements AsyncListener {

        private final ContentCachingResponseWrapper wrapper;
        private final Runnable accessLine;

        AsyncCompletionListener(ContentCachingResponseWrapper wrapper, Runnable accessLine) {
            this.wrapper = wrapper;
            this.accessLine = accessLine;
        }

        @Override
        public void onComplete(AsyncEvent event) throws IOException {
            try {
                accessLine.run();
            } finally {
                wrapper.copyBodyToResponse();
            }
        }

        @Override
        public void onTimeout(AsyncEvent event) {
        }

        @Override
        public void onError(AsyncEvent event) {
        }

        @Override
        public void onStartAsync(AsyncEvent event) {
            // 재시작된 AsyncContext에도 완료 처리 유지
            event.getAsyncContext().addListener(this);
        }
    }
}
