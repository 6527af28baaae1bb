package me.golemcore.gateway.adapter.inbound.web.logstream;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import me.golemcore.gateway.adapter.inbound.web.dto.LogEntryDto;
import me.golemcore.gateway.domain.support.CorrelationMdc;
import me.golemcore.gateway.domain.support.RingBuffer;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
public class GatewayLogService {

    private static final int MIN_PAGE_SIZE = 1;
    private static final String TRUNCATED_SUFFIX = "... [truncated]";
    private static final Pattern BEARER_TOKEN_PATTERN = Pattern.compile("(?i)(Bearer\\s+)[A-Za-z0-9._\\-+/=]+");
    private static final Pattern JSON_SECRET_PATTERN = Pattern.compile(
            "(?i)(\"(?:api[_-]?key|token|password|secret|credential)\"\\s*:\\s*\")([^\"]+)(\")");
    private static final Pattern COMPONENT_PATTERN = Pattern.compile("^\\[([A-Za-z]+)\\]");
    private static final Pattern KEY_VALUE_SECRET_PATTERN = Pattern.compile(
            "(?i)((?:api[_-]?key|token|password|secret|credential)\\s*[:=]\\s*)([^\\s,;)]+)");

    private final RingBuffer<LogEntryDto> entries;
    private final AtomicLong sequence = new AtomicLong(0);
    private final boolean enabled;
    private final int defaultPageSize;
    private final int maxPageSize;
    private final int maxMessageChars;
    private final int maxExceptionChars;

    public GatewayLogService(GatewayProperties properties) {
        GatewayProperties.LogsProperties logsProperties = properties.getLogs();
        this.enabled = logsProperties.isEnabled();
        this.defaultPageSize = normalizePositive(logsProperties.getDefaultPageSize(), 200);
        this.maxPageSize = normalizePositive(logsProperties.getMaxPageSize(), 1000);
        this.maxMessageChars = normalizePositive(logsProperties.getMaxMessageChars(), 8000);
        this.maxExceptionChars = normalizePositive(logsProperties.getMaxExceptionChars(), 16000);
        this.entries = new RingBuffer<>(normalizePositive(logsProperties.getMaxEntries(), 5000));
    }

    public boolean isEnabled() {
        return enabled;
    }

    public LogsSlice getLogsPage(Long beforeSeq, Integer limit) {
        return getLogsPage(beforeSeq, limit, null);
    }

    /**
     * Page of entries older than {@code beforeSeq} (or the newest entries when
     * null), oldest first. A non-blank {@code correlationId} keeps only the
     * lines logged for that dispatch; {@code oldestSeq}/{@code newestSeq}
     * always describe the whole buffer.
     */
    public LogsSlice getLogsPage(Long beforeSeq, Integer limit, String correlationId) {
        if (!enabled) {
            return new LogsSlice(List.of(), null, null, false);
        }

        int pageSize = normalizePageSize(limit);
        List<LogEntryDto> snapshot = entries.snapshot();
        if (snapshot.isEmpty()) {
            return new LogsSlice(List.of(), null, null, false);
        }

        Long oldestSeq = snapshot.get(0).getSeq();
        Long newestSeq = snapshot.get(snapshot.size() - 1).getSeq();
        boolean filtered = correlationId != null && !correlationId.isBlank();

        Deque<LogEntryDto> page = new ArrayDeque<>();
        boolean hasMore = false;
        for (int i = snapshot.size() - 1; i >= 0; i--) {
            LogEntryDto entry = snapshot.get(i);
            if (beforeSeq != null && entry.getSeq() >= beforeSeq) {
                continue;
            }
            if (filtered && !correlationId.equals(entry.getCorrelationId())) {
                continue;
            }
            if (page.size() == pageSize) {
                hasMore = true;
                break;
            }
            page.addFirst(entry);
        }

        return new LogsSlice(List.copyOf(page), oldestSeq, newestSeq, hasMore);
    }

    public void append(ILoggingEvent event) {
        if (!enabled || event == null) {
            return;
        }

        String loggerName = event.getLoggerName();
        if (loggerName != null && loggerName.startsWith("me.golemcore.gateway.adapter.inbound.web.logstream")) {
            return;
        }

        entries.add(LogEntryDto.builder()
                .seq(sequence.incrementAndGet())
                .timestamp(Instant.ofEpochMilli(event.getTimeStamp()).toString())
                .level(event.getLevel() != null ? event.getLevel().toString() : "INFO")
                .logger(loggerName)
                .thread(event.getThreadName())
                .component(component(event.getFormattedMessage()))
                .correlationId(correlationId(event.getMDCPropertyMap()))
                .message(truncate(sanitize(event.getFormattedMessage()), maxMessageChars))
                .exception(extractException(event.getThrowableProxy()))
                .build());
    }

    private int normalizePageSize(Integer requested) {
        int candidate = requested != null ? requested : defaultPageSize;
        if (candidate < MIN_PAGE_SIZE) {
            return MIN_PAGE_SIZE;
        }
        return Math.min(candidate, maxPageSize);
    }

    private int normalizePositive(int value, int fallback) {
        return value > 0 ? value : fallback;
    }

    private String component(String message) {
        if (message == null) {
            return null;
        }
        Matcher matcher = COMPONENT_PATTERN.matcher(message);
        return matcher.find() ? matcher.group(1) : null;
    }

    private String correlationId(Map<String, String> mdc) {
        return mdc != null ? mdc.get(CorrelationMdc.KEY) : null;
    }

    private String extractException(IThrowableProxy throwableProxy) {
        if (throwableProxy == null) {
            return null;
        }
        return truncate(sanitize(ThrowableProxyUtil.asString(throwableProxy)), maxExceptionChars);
    }

    String sanitize(String input) {
        if (input == null || input.isBlank()) {
            return input;
        }

        String sanitized = BEARER_TOKEN_PATTERN.matcher(input).replaceAll("$1***");
        sanitized = JSON_SECRET_PATTERN.matcher(sanitized).replaceAll("$1***$3");
        return KEY_VALUE_SECRET_PATTERN.matcher(sanitized).replaceAll("$1***");
    }

    private String truncate(String input, int maxLength) {
        if (input == null || input.length() <= maxLength) {
            return input;
        }
        int endIndex = Math.max(0, maxLength - TRUNCATED_SUFFIX.length());
        return input.substring(0, endIndex) + TRUNCATED_SUFFIX;
    }

    public record LogsSlice(List<LogEntryDto> items, Long oldestSeq, Long newestSeq, boolean hasMore) {
    }
}
