package io.logscope.engine.query.sql;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.Map;

/**
 * Parses duration strings such as {@code 1h30m}, {@code 250ms} or {@code 1.5h} and renders
 * them as ClickHouse {@code INTERVAL} literals.
 * <p>
 * Accepted units: {@code ns}, {@code us} ({@code µs}), {@code ms}, {@code s}, {@code m}, {@code h}.
 */
public final class DurationLiteral {

    private static final Map<String, Long> UNIT_NANOS = Map.of(
            "ns", 1L,
            "us", 1_000L,
            "µs", 1_000L,
            "μs", 1_000L,
            "ms", 1_000_000L,
            "s", 1_000_000_000L,
            "m", 60_000_000_000L,
            "h", 3_600_000_000_000L
    );

    private static final long SECONDS_PER_MINUTE = 60;
    private static final long SECONDS_PER_HOUR = 3_600;
    private static final long SECONDS_PER_DAY = 86_400;

    private DurationLiteral() {
    }

    public static Duration parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new CompileException("invalid duration: empty");
        }
        String s = text;
        boolean negative = false;
        if (s.charAt(0) == '-' || s.charAt(0) == '+') {
            negative = s.charAt(0) == '-';
            s = s.substring(1);
        }
        if (s.equals("0")) {
            return Duration.ZERO;
        }
        if (s.isEmpty()) {
            throw new CompileException("invalid duration: " + text);
        }

        BigInteger totalNanos = BigInteger.ZERO;
        int i = 0;
        while (i < s.length()) {
            int numberStart = i;
            while (i < s.length() && (Character.isDigit(s.charAt(i)) || s.charAt(i) == '.')) {
                i++;
            }
            String number = s.substring(numberStart, i);
            if (number.isEmpty() || number.equals(".") || number.indexOf('.') != number.lastIndexOf('.')) {
                throw new CompileException("invalid duration: " + text);
            }
            int unitStart = i;
            while (i < s.length() && !Character.isDigit(s.charAt(i)) && s.charAt(i) != '.') {
                i++;
            }
            String unit = s.substring(unitStart, i);
            Long nanosPerUnit = UNIT_NANOS.get(unit);
            if (nanosPerUnit == null) {
                throw new CompileException(unit.isEmpty()
                        ? "missing unit in duration: " + text
                        : "unknown unit '" + unit + "' in duration: " + text);
            }
            BigDecimal value = new BigDecimal(number.endsWith(".") ? number + "0" : number);
            totalNanos = totalNanos.add(value.multiply(BigDecimal.valueOf(nanosPerUnit)).toBigInteger());
        }

        if (totalNanos.bitLength() >= 63) {
            throw new CompileException("duration out of range: " + text);
        }
        Duration duration = Duration.ofNanos(totalNanos.longValueExact());
        return negative ? duration.negated() : duration;
    }

    /**
     * Whole days, hours and minutes keep their unit; anything else is expressed in seconds,
     * truncating sub-second precision.
     */
    public static String toInterval(Duration duration) {
        if (duration.isNegative()) {
            throw new CompileException("negative durations are not supported: " + duration);
        }
        long seconds = duration.getSeconds();
        boolean whole = duration.getNano() == 0;
        if (whole && seconds >= SECONDS_PER_DAY && seconds % SECONDS_PER_DAY == 0) {
            return "INTERVAL " + seconds / SECONDS_PER_DAY + " DAY";
        }
        if (whole && seconds >= SECONDS_PER_HOUR && seconds % SECONDS_PER_HOUR == 0) {
            return "INTERVAL " + seconds / SECONDS_PER_HOUR + " HOUR";
        }
        if (whole && seconds >= SECONDS_PER_MINUTE && seconds % SECONDS_PER_MINUTE == 0) {
            return "INTERVAL " + seconds / SECONDS_PER_MINUTE + " MINUTE";
        }
        return "INTERVAL " + seconds + " SECOND";
    }

    public static String toInterval(String text) {
        return toInterval(parse(text));
    }
}
