package com.wangbin.sentinel.core.source;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 查询时间范围。支持相对表达式（-24h、-30m、-7d、-1w、-2y、-10s，
 * 以及 now() - 1h 形式）和 ISO-8601 绝对时间，end 为空表示直到当前。
 */
public final class TimeRange {

    private static final Pattern RELATIVE = Pattern.compile("^-(\\d+)(ms|s|m|h|d|w|y)$");
    private static final Pattern NOW_EXPR = Pattern.compile(
            "^now\\(\\)\\s*(?:-\\s*(?:interval\\s*)?'?(\\d+)\\s*(ms|s|m|h|d|w|y)'?)?$");

    private final Instant start;
    private final Instant end;
    private final String expression;

    private TimeRange(Instant start, Instant end, String expression) {
        this.start = Objects.requireNonNull(start, "start");
        this.end = end;
        this.expression = expression;
        if (end != null && end.isBefore(start)) {
            throw new IllegalArgumentException("时间范围结束早于开始: " + start + " > " + end);
        }
    }

    public static TimeRange between(Instant start, Instant end) {
        return new TimeRange(start, end, null);
    }

    public static TimeRange since(Instant start) {
        return new TimeRange(start, null, null);
    }

    public static TimeRange parse(String expression, Clock clock) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("时间范围不能为空");
        }
        String text = expression.trim();
        String lower = text.toLowerCase(Locale.ROOT);

        Matcher relative = RELATIVE.matcher(lower);
        if (relative.matches()) {
            Duration back = toDuration(Long.parseLong(relative.group(1)), relative.group(2));
            return new TimeRange(clock.instant().minus(back), null, text);
        }

        Matcher now = NOW_EXPR.matcher(lower);
        if (now.matches()) {
            Duration back = now.group(1) == null
                    ? Duration.ZERO
                    : toDuration(Long.parseLong(now.group(1)), now.group(2));
            return new TimeRange(clock.instant().minus(back), null, text);
        }

        try {
            return new TimeRange(Instant.parse(text), null, text);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("无法解析的时间范围: " + expression, e);
        }
    }

    static Duration toDuration(long amount, String unit) {
        return switch (unit) {
            case "ms" -> Duration.ofMillis(amount);
            case "s" -> Duration.ofSeconds(amount);
            case "m" -> Duration.ofMinutes(amount);
            case "h" -> Duration.ofHours(amount);
            case "d" -> Duration.ofDays(amount);
            case "w" -> Duration.ofDays(amount * 7);
            case "y" -> Duration.ofDays(amount * 365);
            default -> throw new IllegalArgumentException("未知的时间单位: " + unit);
        };
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && (end == null || !instant.isAfter(end));
    }

    /**
     * 从 after（不含）开始的新范围，用于持续轮询
     */
    public TimeRange resumeAfter(Instant after) {
        Instant from = after.isAfter(start) ? after : start;
        return new TimeRange(from, end, null);
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeRange other)) {
            return false;
        }
        return start.equals(other.start) && Objects.equals(end, other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        String range = "[" + start + ", " + (end == null ? "now" : end.toString()) + "]";
        return expression == null ? range : expression + " " + range;
    }
}
