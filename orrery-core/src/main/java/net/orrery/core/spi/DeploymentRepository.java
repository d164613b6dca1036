package net.orrery.core.spi;

import net.orrery.core.model.Deployment;
import net.orrery.core.model.Schedule;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DeploymentRepository {
    /** Inserts the deployment and its schedules. A duplicate name fails with the store's integrity error. */
    Deployment create(Deployment deployment) throws Exception;

    /** Loaded together with all of its schedules. */
    Optional<Deployment> findById(UUID id) throws Exception;
    Optional<Deployment> findByName(String name) throws Exception;

    /** Ordered by id; null offset/limit means unbounded. */
    List<Deployment> findAll(Integer offset, Integer limit) throws Exception;

    /** @return whether a deployment was deleted */
    boolean delete(UUID id) throws Exception;

    Schedule addSchedule(UUID deploymentId, Schedule schedule) throws Exception;
    boolean removeSchedule(UUID scheduleId) throws Exception;
}
