package fr.imt.chronos.chronos.business.port;

import fr.imt.chronos.chronos.infrastructure.persistence.Execution;

public interface ExecutionEventPublisherPort {
    void publish(Execution execution);
}
