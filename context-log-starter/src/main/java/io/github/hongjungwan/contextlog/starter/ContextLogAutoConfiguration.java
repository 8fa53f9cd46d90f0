package io.github.hongjungwan.contextlog.starter;

import io.github.hongjungwan.contextlog.api.config.LogContextSettings;
import io.github.hongjungwan.contextlog.api.context.LogContextProvider;
import io.github.hongjungwan.contextlog.core.config.LogConfigurator;
import io.github.hongjungwan.contextlog.core.context.LogContextRegistry;
import io.github.hongjungwan.contextlog.core.context.builtin.TraceIdContextProvider;
import io.github.hongjungwan.contextlog.starter.web.LogContextServletFilter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Context Log Spring Boot 자동 설정.
 */
@AutoConfiguration
@EnableConfigurationProperties(ContextLogProperties.class)
@ConditionalOnProperty(prefix = "context-log", name = "enabled", havingValue = "true", matchIfMissing = true)
@Import(ContextLogAutoConfiguration.ServletFilterConfiguration.class)
@Slf4j
public class ContextLogAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public LogContextSettings logContextSettings(ContextLogProperties properties) {
        return LogContextSettings.builder()
                .logLevel(properties.getLogLevel())
                .logContexts(properties.getLogContexts())
                .logConfigPath(properties.getLogConfigPath())
                .traceIdHeader(properties.getTraceIdHeader())
                .serverLoggerName(properties.getLoggers().getServer())
                .errorLoggerName(properties.getLoggers().getError())
                .accessLoggerName(properties.getLoggers().getAccess())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public LogContextRegistry logContextRegistry(
            LogContextSettings settings,
            ObjectProvider<LogContextProvider<?>> customContexts
    ) {
        LogContextRegistry registry = new LogContextRegistry();

        for (String name : settings.getLogContexts()) {
            if (TraceIdContextProvider.NAME.equals(name)) {
                registry.register(name, new TraceIdContextProvider(settings.getTraceIdHeader()));
            } else {
                registry.registerBuiltin(name);
            }
        }

        // 애플리케이션이 등록한 context bean은 builtin 뒤에 추가 (같은 이름이면 교체)
        customContexts.orderedStream().forEach(context -> registry.register(context.getName(), context));

        log.info("Log contexts registered: {}", registry.names());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public LogConfigurator logConfigurator(LogContextSettings settings, LogContextRegistry registry) {
        return new LogConfigurator(settings, registry);
    }

    @Bean
    public ContextLogLifecycle contextLogLifecycle(LogConfigurator configurator, ContextLogProperties properties) {
        return new ContextLogLifecycle(configurator, properties.isApplyOnStartup());
    }

    /**
     * 기동 시 로깅 설정을 합성하여 Logback에 적용하는 SmartLifecycle 구현체.
     */
    static class ContextLogLifecycle implements SmartLifecycle {

        private final LogConfigurator configurator;
        private final boolean applyOnStartup;
        private volatile boolean running = false;

        ContextLogLifecycle(LogConfigurator configurator, boolean applyOnStartup) {
            this.configurator = configurator;
            this.applyOnStartup = applyOnStartup;
        }

        @Override
        public void start() {
            if (applyOnStartup) {
                configurator.configure(null, true);
            } else {
                log.info("Context log configuration not applied (context-log.apply-on-startup=false)");
            }
            running = true;
        }

        @Override
        public void stop() {
            running = false;
        }

        @Override
        public boolean isRunning() {
            return running;
        }

        @Override
        public int getPhase() {
            return Integer.MIN_VALUE + 100;
        }
    }

    /**
     * Servlet 애플리케이션에서 요청마다 middleware chain을 실행하는 filter 등록.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(OncePerRequestFilter.class)
    static class ServletFilterConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "logContextServletFilter")
        public FilterRegistrationBean<LogContextServletFilter> logContextServletFilter(
                LogContextRegistry registry,
                LogContextSettings settings,
                ContextLogProperties properties
        ) {
            LogContextServletFilter filter = new LogContextServletFilter(
                    registry,
                    LoggerFactory.getLogger(settings.getAccessLoggerName()),
                    properties.getAccess().isEnabled());

            FilterRegistrationBean<LogContextServletFilter> registration = new FilterRegistrationBean<>(filter);
            registration.setName("logContextServletFilter");
            registration.setOrder(properties.getFilterOrder());
            registration.addUrlPatterns("/*");
            return registration;
        }
    }
}
