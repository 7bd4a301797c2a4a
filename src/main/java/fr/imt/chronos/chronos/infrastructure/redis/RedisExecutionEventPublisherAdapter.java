package fr.imt.chronos.chronos.infrastructure.redis;

import fr.imt.chronos.chronos.business.port.ExecutionEventPublisherPort;
import fr.imt.chronos.chronos.configuration.RedisConfiguration;
import fr.imt.chronos.chronos.infrastructure.persistence.Execution;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class RedisExecutionEventPublisherAdapter implements ExecutionEventPublisherPort {

    private final StringRedisTemplate redisTemplate;

    @Override
    public void publish(Execution execution) {
        try {
            // Simple protocol: jobId|executionId|status|durationMs
            String message = String.format("%s|%s|%s|%d",
                    execution.getJobId(),
                    execution.getId(),
                    execution.getStatus(),
                    execution.getDurationMs());
            redisTemplate.convertAndSend(RedisConfiguration.EXECUTIONS_TOPIC, message);
        } catch (Exception e) {
            log.error("Failed to publish execution {} of job {}", execution.getId(), execution.getJobId(), e);
        }
    }
}
