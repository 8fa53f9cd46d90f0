package io.github.hongjungwan.contextlog.core.context;

import io.github.hongjungwan.contextlog.api.exception.BuiltinContextAmbiguousException;
import io.github.hongjungwan.contextlog.api.exception.BuiltinContextNotFoundException;
import io.github.hongjungwan.contextlog.core.context.builtin.ResponseTimeContextProvider;
import io.github.hongjungwan.contextlog.core.context.builtin.TraceIdContextProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BuiltinContextProviders")
class BuiltinContextProvidersTest {

    @Test
    @DisplayName("bundled table should list the shipped contexts")
    void shouldListBundledContexts() {
        BuiltinContextProviders builtins = BuiltinContextProviders.bundled().build();

        assertThat(builtins.names())
                .containsExactly("correlation_id", "request_id", "trace_id", "user_id", "response_time");
    }

    @Test
    @DisplayName("standard table should include ServiceLoader contributions")
    void shouldIncludeServiceLoaderContexts() {
        BuiltinContextProviders builtins = BuiltinContextProviders.standard();

        assertThat(builtins.names()).contains("tenant_id", "trace_id");
        assertThat(builtins.create("tenant_id").getName()).isEqualTo("tenant_id");
    }

    @Test
    @DisplayName("should create a new instance on every call")
    void shouldCreateFreshInstances() {
        BuiltinContextProviders builtins = BuiltinContextProviders.bundled().build();

        assertThat(builtins.create("trace_id"))
                .isInstanceOf(TraceIdContextProvider.class)
                .isNotSameAs(builtins.create("trace_id"));
        assertThat(builtins.create("response_time")).isInstanceOf(ResponseTimeContextProvider.class);
    }

    @Test
    @DisplayName("should reject unknown and doubly claimed names")
    void shouldRejectUnresolvableNames() {
        BuiltinContextProviders builtins = BuiltinContextProviders.bundled()
                .add("trace_id", () -> new TraceIdContextProvider("traceparent"))
                .build();

        assertThatThrownBy(() -> builtins.create("nope"))
                .isInstanceOf(BuiltinContextNotFoundException.class)
                .hasMessage("Builtin log context 'nope' not found");
        assertThatThrownBy(() -> builtins.create("trace_id"))
                .isInstanceOf(BuiltinContextAmbiguousException.class);
    }
}
