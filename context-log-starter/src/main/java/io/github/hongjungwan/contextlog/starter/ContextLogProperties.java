package io.github.hongjungwan.contextlog.starter;

import io.github.hongjungwan.contextlog.api.config.LogContextSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Context Log 설정 Properties (prefix: context-log).
 */
@Data
@ConfigurationProperties(prefix = "context-log")
public class ContextLogProperties {

    /** Spring Security 필터 체인(-100) 바로 다음 */
    public static final int DEFAULT_FILTER_ORDER = -100 + 10;

    /** 활성화 여부 */
    private boolean enabled = true;

    /** 기본 handler/logger 레벨 */
    private String logLevel = "INFO";

    /** 등록할 builtin context 이름 (순서대로 로그 패턴과 middleware 중첩 순서가 결정됨) */
    private List<String> logContexts = new ArrayList<>(List.of("correlation_id", "request_id", "trace_id", "user_id"));

    /** baseline 위에 병합할 YAML 파일 경로 */
    private String logConfigPath = "logging.yml";

    /** trace_id context가 읽고 응답에 기록하는 헤더 */
    private String traceIdHeader = LogContextSettings.DEFAULT_TRACE_ID_HEADER;

    /** 기동 시 Logback 설정 적용 여부 */
    private boolean applyOnStartup = true;

    /** Servlet filter 순서 (기본값: 인증 필터 다음에 실행되어 user_id를 읽을 수 있음) */
    private int filterOrder = DEFAULT_FILTER_ORDER;

    /** baseline에 바인딩되는 logger 이름 */
    private LoggerNames loggers = new LoggerNames();

    /** Access 로그 설정 */
    private AccessProperties access = new AccessProperties();

    @Data
    public static class LoggerNames {
        private String server = "org.apache.catalina";
        private String error = "org.springframework.web";
        private String access = "http.access";
    }

    @Data
    public static class AccessProperties {
        /** 요청당 access 로그 한 줄 기록 여부 */
        private boolean enabled = true;
    }
}
