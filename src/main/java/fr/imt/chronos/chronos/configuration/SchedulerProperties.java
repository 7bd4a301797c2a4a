package fr.imt.chronos.chronos.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

@Data
@ConfigurationProperties(prefix = "chronos.scheduler")
public class SchedulerProperties {

    /**
     * Zone in which recurrence rules are evaluated.
     */
    private ZoneId zone = ZoneId.systemDefault();

    /**
     * Threads that only wait for due times and hand firings off.
     */
    private int timerPoolSize = 2;

    /**
     * Threads that run job bodies.
     */
    private int workerPoolSize = 8;

    /**
     * Re-arm every persisted active job once the application is ready.
     */
    private boolean reconcileOnStartup = true;

    private int recentExecutionLimit = 10;

    private int executionListLimit = 100;

}
