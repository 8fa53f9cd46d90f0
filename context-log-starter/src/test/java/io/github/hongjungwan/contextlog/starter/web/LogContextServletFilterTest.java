package io.github.hongjungwan.contextlog.starter.web;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.github.hongjungwan.contextlog.core.context.BuiltinContextProviders;
import io.github.hongjungwan.contextlog.core.context.LogContextRegistry;
import io.github.hongjungwan.contextlog.core.context.builtin.CorrelationIdContextProvider;
import io.github.hongjungwan.contextlog.core.context.builtin.RequestIdContextProvider;
import io.github.hongjungwan.contextlog.core.context.builtin.UserIdContextProvider;
import io.github.hongjungwan.contextlog.core.logback.ContextLogFilter;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LogContextServletFilter")
class LogContextServletFilterTest {

    private final CorrelationIdContextProvider correlation = new CorrelationIdContextProvider();
    private final RequestIdContextProvider requestId = new RequestIdContextProvider();
    private final UserIdContextProvider userId = new UserIdContextProvider();

    private LogContextRegistry registry;
    private Logger accessLogger;
    private ListAppender<ILoggingEvent> accessEvents;

    private MockHttpServletRequest request;
    private MockHttpServletResponse response;

    @BeforeEach
    void setUp() {
        registry = new LogContextRegistry(BuiltinContextProviders.bundled().build());
        registry.register(CorrelationIdContextProvider.NAME, correlation);
        registry.register(RequestIdContextProvider.NAME, requestId);
        registry.register(UserIdContextProvider.NAME, userId);

        LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        accessLogger = loggerContext.getLogger("test.access." + UUID.randomUUID());
        accessLogger.setAdditive(false);
        accessEvents = new ListAppender<>();
        accessEvents.start();
        accessLogger.addAppender(accessEvents);

        request = new MockHttpServletRequest("GET", "/api/orders");
        response = new MockHttpServletResponse();
    }

    @AfterEach
    void tearDown() {
        accessLogger.detachAndStopAllAppenders();
    }

    private LogContextServletFilter filter(boolean accessLogEnabled) {
        return new LogContextServletFilter(registry, accessLogger, accessLogEnabled);
    }

    @Nested
    @DisplayName("Context binding")
    class BindingTests {

        @Test
        @DisplayName("should bind header values downstream and echo them after the body is written")
        void shouldBindAndEchoHeader() throws Exception {
            request.addHeader("x-correlation-id", "abc-123");
            List<String> seen = new ArrayList<>();
            FilterChain chain = (req, res) -> {
                seen.add(correlation.current());
                res.getWriter().write("ok");
            };

            filter(true).doFilter(request, response, chain);

            assertThat(seen).containsExactly("abc-123");
            assertThat(response.getHeader("X-Correlation-Id")).isEqualTo("abc-123");
            assertThat(response.getContentAsString()).isEqualTo("ok");
            assertThat(correlation.current()).isEqualTo("-");
        }

        @Test
        @DisplayName("should generate one id per request and use it for both state and header")
        void shouldGenerateIdsWhenMissing() throws Exception {
            List<String> seen = new ArrayList<>();
            FilterChain chain = (req, res) -> seen.add(requestId.current());

            filter(true).doFilter(request, response, chain);
            MockHttpServletResponse second = new MockHttpServletResponse();
            filter(true).doFilter(new MockHttpServletRequest("GET", "/api/orders"), second, chain);

            assertThat(seen).hasSize(2).doesNotHaveDuplicates();
            assertThat(response.getHeader("X-Request-Id")).isEqualTo(seen.get(0));
            assertThat(second.getHeader("X-Request-Id")).isEqualTo(seen.get(1));
        }

        @Test
        @DisplayName("should expose values as request attributes and read the upstream user")
        void shouldUseRequestAttributes() throws Exception {
            request.setAttribute("user_id", "emp_1001");
            request.addHeader("X-Request-Id", "req-1");
            List<String> seen = new ArrayList<>();

            filter(true).doFilter(request, response, (req, res) -> seen.add(userId.current()));

            assertThat(seen).containsExactly("emp_1001");
            assertThat(request.getAttribute("request_id")).isEqualTo("req-1");
            assertThat(request.getAttribute("user_id")).isEqualTo("emp_1001");
            assertThat(userId.current()).isEqualTo("anonymous");
        }

        @Test
        @DisplayName("should propagate downstream failures unchanged and still reset")
        void shouldPropagateFailure() {
            request.addHeader("X-Correlation-Id", "abc-123");
            ServletException failure = new ServletException("boom");

            assertThatThrownBy(() -> filter(true).doFilter(request, response, (req, res) -> {
                throw failure;
            })).isSameAs(failure);

            assertThat(correlation.current()).isEqualTo("-");
            assertThat(response.getHeader("X-Correlation-Id")).isNull();
            assertThat(accessEvents.list).isEmpty();
        }
    }

    @Nested
    @DisplayName("Access log")
    class AccessLogTests {

        @Test
        @DisplayName("should write one line per request while contexts are bound")
        void shouldWriteAccessLine() throws Exception {
            request.addHeader("X-Request-Id", "req-5");
            accessEvents.addFilter(new ContextLogFilter(requestId));

            filter(true).doFilter(request, response,
                    (req, res) -> ((HttpServletResponse) res).setStatus(201));

            assertThat(accessEvents.list).hasSize(1);
            ILoggingEvent event = accessEvents.list.get(0);
            assertThat(event.getFormattedMessage()).isEqualTo("GET /api/orders 201");
            assertThat(event.getKeyValuePairs())
                    .extracting(pair -> pair.key + "=" + pair.value)
                    .containsExactly("request_id=req-5");
        }

        @Test
        @DisplayName("should stay silent when disabled")
        void shouldSkipWhenDisabled() throws Exception {
            filter(false).doFilter(request, response, (req, res) -> { });

            assertThat(accessEvents.list).isEmpty();
        }
    }

    @Nested
    @DisplayName("Authenticated user")
    class UserTests {

        @Test
        @DisplayName("should read the user_id attribute set by a preceding filter")
        void shouldReadUserFromPrecedingFilter() throws Exception {
            List<String> seen = new ArrayList<>();
            Filter authentication = (req, res, next) -> {
                req.setAttribute("user_id", "emp_1001");
                next.doFilter(req, res);
            };
            MockFilterChain chain = new MockFilterChain(recordingServlet(seen), authentication, filter(true));

            chain.doFilter(request, response);

            assertThat(seen).containsExactly("emp_1001");
            assertThat(userId.current()).isEqualTo("anonymous");
        }

        @Test
        @DisplayName("should fall back to the authenticated principal")
        void shouldUsePrincipal() throws Exception {
            request.setUserPrincipal(() -> "emp_2002");
            List<String> seen = new ArrayList<>();

            filter(true).doFilter(request, response, (req, res) -> seen.add(userId.current()));

            assertThat(seen).containsExactly("emp_2002");
        }

        @Test
        @DisplayName("an explicit user_id attribute should win over the principal")
        void shouldPreferAttributeOverPrincipal() throws Exception {
            request.setUserPrincipal(() -> "principal");
            request.setAttribute("user_id", "emp_1001");
            List<String> seen = new ArrayList<>();

            filter(true).doFilter(request, response, (req, res) -> seen.add(userId.current()));

            assertThat(seen).containsExactly("emp_1001");
        }

        private HttpServlet recordingServlet(List<String> seen) {
            return new HttpServlet() {
                @Override
                protected void service(HttpServletRequest req, HttpServletResponse resp) {
                    seen.add(userId.current());
                }
            };
        }
    }

    @Nested
    @DisplayName("Async requests")
    class AsyncTests {

        @Test
        @DisplayName("should deliver a body written after the filter returns")
        void shouldCopyLateBody() throws Exception {
            request.setAsyncSupported(true);
            request.addHeader("X-Request-Id", "req-async");
            AtomicReference<AsyncContext> async = new AtomicReference<>();

            filter(true).doFilter(request, response, (req, res) -> async.set(req.startAsync(req, res)));

            assertThat(response.getContentAsString()).isEmpty();
            assertThat(accessEvents.list).isEmpty();

            AsyncContext context = async.get();
            ((HttpServletResponse) context.getResponse()).setStatus(202);
            context.getResponse().getWriter().write("late-body");
            context.getResponse().flushBuffer();
            context.complete();

            assertThat(response.getContentAsString()).isEqualTo("late-body");
            assertThat(response.getHeader("X-Request-Id")).isEqualTo("req-async");
            assertThat(requestId.current()).isEqualTo("-");
        }

        @Test
        @DisplayName("should log the final status with the request's context on completion")
        void shouldLogAccessOnCompletion() throws Exception {
            request.setAsyncSupported(true);
            request.addHeader("X-Request-Id", "req-async");
            accessEvents.addFilter(new ContextLogFilter(requestId));
            AtomicReference<AsyncContext> async = new AtomicReference<>();

            filter(true).doFilter(request, response, (req, res) -> async.set(req.startAsync(req, res)));
            ((HttpServletResponse) async.get().getResponse()).setStatus(202);
            async.get().complete();

            assertThat(accessEvents.list).hasSize(1);
            ILoggingEvent event = accessEvents.list.get(0);
            assertThat(event.getFormattedMessage()).isEqualTo("GET /api/orders 202");
            assertThat(event.getKeyValuePairs())
                    .extracting(pair -> pair.key + "=" + pair.value)
                    .containsExactly("request_id=req-async");
        }
    }
}
