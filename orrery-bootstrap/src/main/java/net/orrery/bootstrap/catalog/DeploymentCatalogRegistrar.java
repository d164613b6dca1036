package net.orrery.bootstrap.catalog;

import net.orrery.bootstrap.props.OrreryProperties;
import net.orrery.core.model.ClockSpec;
import net.orrery.core.model.Deployment;
import net.orrery.core.model.Schedule;
import net.orrery.core.spi.DeploymentRepository;
import net.orrery.core.spi.TxRunner;
import net.orrery.integration.spring.cron.CronSlotPlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/** Creates the deployments declared in configuration. Existing names are left alone. */
public class DeploymentCatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(DeploymentCatalogRegistrar.class);

    private final DeploymentRepository deployments;
    private final TxRunner tx;
    private final ZoneId zone;

    public DeploymentCatalogRegistrar(DeploymentRepository deployments, TxRunner tx, ZoneId zone) {
        this.deployments = deployments;
        this.tx = tx;
        this.zone = zone;
    }

    /** @return ids of the deployments created by this call */
    public List<UUID> register(OrreryProperties.Catalog catalog) throws Exception {
        List<UUID> created = new ArrayList<>();
        for (var def : catalog.getDeployments()) {
            Deployment candidate = toDeployment(def);
            UUID id = tx.required(() -> {
                if (deployments.findByName(def.getName()).isPresent()) return null;
                return deployments.create(candidate).id();
            });
            if (id == null) {
                log.info("Catalog deployment '{}' already exists, left unchanged", def.getName());
            } else {
                created.add(id);
                log.info("Catalog registered: deployment='{}' id={} schedules={}", def.getName(), id, def.getSchedules().size());
            }
        }
        return created;
    }

    private Deployment toDeployment(OrreryProperties.DeploymentDef def) {
        if (def.getName() == null || def.getName().isBlank() || def.getFlowId() == null) {
            throw new IllegalArgumentException("deployment.name and deployment.flow-id are required: " + def);
        }
        List<Schedule> schedules = new ArrayList<>();
        for (var s : def.getSchedules()) {
            Schedule schedule = Schedule.ofNew(toClock(def.getName(), s), s.getParameters());
            schedules.add(s.isActive() ? schedule
                    : new Schedule(schedule.id(), null, schedule.clock(), schedule.parameters(), false, null));
        }
        return Deployment.ofNew(def.getName(), def.getFlowId(), schedules);
    }

    private ClockSpec toClock(String deployment, OrreryProperties.ScheduleDef s) {
        boolean cron = s.getCron() != null && !s.getCron().isBlank();
        if (cron == (s.getInterval() != null)) {
            throw new IllegalArgumentException("schedule of '" + deployment + "' needs exactly one of cron or interval: " + s);
        }
        if (cron) {
            CronSlotPlanner.validate(s.getCron());
            String tz = s.getTimezone() == null || s.getTimezone().isBlank() ? zone.getId() : s.getTimezone();
            ZoneId.of(tz); // fail fast on unknown zones
            return ClockSpec.cron(s.getCron(), tz);
        }
        return ClockSpec.interval(s.getInterval(), s.getAnchor() == null ? ClockSpec.DEFAULT_ANCHOR : s.getAnchor());
    }
}
