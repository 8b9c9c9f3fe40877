package io.marshalxform.core.field;

import java.math.BigDecimal;
import java.time.Duration;

/** Duration field. Dumps a {@link Duration} as whole seconds; loads seconds (fractions allowed). */
public class TimeDeltaField extends Field {

    private static final BigDecimal NANOS_PER_SECOND = BigDecimal.valueOf(1_000_000_000L);

    @Override
    public String kind() {
        return "timedelta";
    }

    @Override
    protected Object format(Object value) {
        if (!(value instanceof Duration)) {
            throw dumpError(quoted(value) + " cannot be formatted as a timedelta.");
        }
        return ((Duration) value).getSeconds();
    }

    @Override
    protected Object convert(Object value) {
        if (value instanceof Duration) {
            return value;
        }
        try {
            BigDecimal seconds = DecimalSupport.toBigDecimal(value);
            BigDecimal whole = new BigDecimal(seconds.toBigInteger());
            long nanos = seconds.subtract(whole).multiply(NANOS_PER_SECOND).longValue();
            return Duration.ofSeconds(whole.longValueExact(), nanos);
        } catch (NumberFormatException | ArithmeticException e) {
            throw loadError(quoted(value) + " cannot be deserialized to a timedelta.", e);
        }
    }
}
