package fr.imt.chronos.chronos.business.schedule;

import fr.imt.chronos.chronos.business.model.RecurrenceType;
import fr.imt.chronos.chronos.configuration.SchedulerProperties;
import fr.imt.chronos.chronos.exception.InvalidRecurrenceException;
import fr.imt.chronos.chronos.infrastructure.persistence.RecurrenceConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Turns a recurrence rule into a six-field cron expression
 * ({@code second minute hour day-of-month month day-of-week}) and evaluates it.
 * <p>
 * Holds no state besides the zone, so the same expression and the same
 * starting instant always give the same next fire time.
 */
@Component
public class RecurrenceCompiler {

    static final String MINUTE = "minute";
    static final String HOUR = "hour";
    static final String DAY_OF_WEEK = "dayOfWeek";

    private final ZoneId zone;

    @Autowired
    public RecurrenceCompiler(SchedulerProperties properties) {
        this(properties.getZone());
    }

    public RecurrenceCompiler(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * Compile a recurrence rule.
     *
     * @param type   hourly, daily or weekly
     * @param config offsets, may be {@code null}; missing fields default to 0
     * @return the schedule expression
     * @throws InvalidRecurrenceException if the type is missing or a supplied field is out of bounds
     */
    public String compile(RecurrenceType type, RecurrenceConfig config) {
        if (type == null) {
            throw new InvalidRecurrenceException("type", "type must be one of hourly, daily, weekly");
        }
        RecurrenceConfig offsets = config != null ? config : new RecurrenceConfig();

        int minute = checkBounds(MINUTE, offsets.getMinute(), 0, 59);
        int hour = checkBounds(HOUR, offsets.getHour(), 0, 23);
        int dayOfWeek = checkBounds(DAY_OF_WEEK, offsets.getDayOfWeek(), 0, 6);

        return switch (type) {
            case HOURLY -> String.format("0 %d * * * *", minute);
            case DAILY -> String.format("0 %d %d * * *", minute, hour);
            case WEEKLY -> String.format("0 %d %d * * %d", minute, hour, dayOfWeek);
        };
    }

    /**
     * @return the first fire time strictly after {@code from}
     */
    public Instant nextFireTime(String scheduleExpression, Instant from) {
        CronExpression cron = CronExpression.parse(scheduleExpression);
        ZonedDateTime next = cron.next(from.atZone(zone));
        if (next == null) {
            throw new IllegalStateException("Schedule " + scheduleExpression + " has no fire time after " + from);
        }
        return next.toInstant();
    }

    public ZoneId getZone() {
        return zone;
    }

    private static int checkBounds(String field, Integer value, int min, int max) {
        if (value == null) {
            return 0;
        }
        if (value < min || value > max) {
            throw new InvalidRecurrenceException(field, value, min, max);
        }
        return value;
    }
}
