package io.github.hongjungwan.contextlog.test;

import io.github.hongjungwan.contextlog.core.context.BuiltinContextProviders;
import io.github.hongjungwan.contextlog.core.context.LogContextRegistry;
import io.github.hongjungwan.contextlog.core.context.SimpleContextRequest;
import io.github.hongjungwan.contextlog.core.context.SimpleContextResponse;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.github.hongjungwan.contextlog.test.LogEventAssert.assertThatEvent;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Test LogCapture utility
 */
class LogCaptureTest {

    private static final String LOGGER_NAME = "io.github.hongjungwan.contextlog.test.orders";

    @Test
    void testCapturesContextOfRequest() {
        LogContextRegistry registry = new LogContextRegistry(BuiltinContextProviders.bundled().build());
        registry.registerBuiltin("request_id");
        registry.registerBuiltin("user_id");
        Logger logger = LoggerFactory.getLogger(LOGGER_NAME);

        try (LogCapture capture = LogCapture.attach(LOGGER_NAME, registry)) {
            registry.createMiddlewareChain().execute(
                    new SimpleContextRequest().withHeader("X-Request-Id", "req-1").withAttribute("user_id", "emp_1001"),
                    request -> {
                        logger.info("order {} placed", "o-1");
                        return new SimpleContextResponse();
                    });
            logger.info("after request");

            assertThat(capture.events()).hasSize(2);
            assertThatEvent(capture.events().get(0))
                    .hasMessage("order o-1 placed")
                    .hasContextValue("request_id", "req-1")
                    .hasContextValue("user_id", "emp_1001");
            assertThatEvent(capture.lastEvent())
                    .hasContextValue("request_id", "-")
                    .hasContextValue("user_id", "anonymous");
        }
    }

    @Test
    void testDetachOnClose() {
        LogContextRegistry registry = new LogContextRegistry(BuiltinContextProviders.bundled().build());
        Logger logger = LoggerFactory.getLogger(LOGGER_NAME);

        LogCapture capture = LogCapture.attach(LOGGER_NAME, registry);
        capture.close();
        logger.info("not captured");

        assertThat(capture.events()).isEmpty();
        assertThatThrownBy(capture::lastEvent).isInstanceOf(IllegalStateException.class);
    }
}
