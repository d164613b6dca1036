package net.orrery.core.support;

import net.orrery.core.model.Deployment;
import net.orrery.core.model.Schedule;
import net.orrery.core.spi.DeploymentRepository;

import java.time.Instant;
import java.util.*;

public final class InMemoryDeploymentRepository implements DeploymentRepository {
    private final Map<UUID, Deployment> rows = new TreeMap<>(Comparator.comparing(UUID::toString));
    private final Set<UUID> failing = new HashSet<>();

    /** findById of this deployment throws from now on. */
    public void failOn(UUID id) {
        failing.add(id);
    }

    @Override
    public synchronized Deployment create(Deployment d) {
        if (rows.values().stream().anyMatch(x -> x.name().equals(d.name()))) {
            throw new IllegalStateException("duplicate name " + d.name());
        }
        Instant now = Instant.now();
        List<Schedule> schedules = d.schedules().stream().map(s -> s.withDeployment(d.id())).toList();
        Deployment stored = new Deployment(d.id(), d.name(), d.flowId(), schedules, now, now);
        rows.put(d.id(), stored);
        return stored;
    }

    @Override
    public synchronized Optional<Deployment> findById(UUID id) {
        if (failing.contains(id)) throw new IllegalStateException("boom " + id);
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public synchronized Optional<Deployment> findByName(String name) {
        return rows.values().stream().filter(d -> d.name().equals(name)).findFirst();
    }

    @Override
    public synchronized List<Deployment> findAll(Integer offset, Integer limit) {
        return rows.values().stream()
                .skip(offset == null ? 0 : offset)
                .limit(limit == null ? Long.MAX_VALUE : limit)
                .toList();
    }

    @Override
    public synchronized boolean delete(UUID id) {
        return rows.remove(id) != null;
    }

    @Override
    public synchronized Schedule addSchedule(UUID deploymentId, Schedule schedule) {
        Deployment d = rows.get(deploymentId);
        Schedule s = schedule.withDeployment(deploymentId);
        List<Schedule> schedules = new ArrayList<>(d.schedules());
        schedules.add(s);
        rows.put(deploymentId, new Deployment(d.id(), d.name(), d.flowId(), schedules, d.createdAt(), Instant.now()));
        return s;
    }

    @Override
    public synchronized boolean removeSchedule(UUID scheduleId) {
        for (Deployment d : rows.values()) {
            List<Schedule> kept = d.schedules().stream().filter(s -> !s.id().equals(scheduleId)).toList();
            if (kept.size() != d.schedules().size()) {
                rows.put(d.id(), new Deployment(d.id(), d.name(), d.flowId(), kept, d.createdAt(), d.updatedAt()));
                return true;
            }
        }
        return false;
    }
}
