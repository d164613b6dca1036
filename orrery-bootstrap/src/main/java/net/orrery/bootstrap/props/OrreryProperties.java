package net.orrery.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@ConfigurationProperties("orrery")
public class OrreryProperties {
    /** Timezone for catalog cron schedules that do not name one. */
    private String zone = "UTC";
    private Storage storage = new Storage();
    private Scheduler scheduler = new Scheduler();
    private Catalog catalog = new Catalog();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Storage {
        /** postgresql or sqlite; detected from the DataSource when blank. */
        private String dialect;
        /** auto, update_join or correlated_subquery. */
        private String linkStrategy = "auto";

        public String getDialect() {
            return dialect;
        }

        public void setDialect(String dialect) {
            this.dialect = dialect;
        }

        public String getLinkStrategy() {
            return linkStrategy;
        }

        public void setLinkStrategy(String linkStrategy) {
            this.linkStrategy = linkStrategy;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private long tickDelayMs = 10000;
        private long maintenanceDelayMs = 60000;
        private int maxRuns = 100;
        private Duration horizon = Duration.ofDays(365);
        private int pageSize = 200;
        private Duration orphanMinAge = Duration.ofMinutes(5);
        private int orphanBatch = 500;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getTickDelayMs() {
            return tickDelayMs;
        }

        public void setTickDelayMs(long tickDelayMs) {
            this.tickDelayMs = tickDelayMs;
        }

        public long getMaintenanceDelayMs() {
            return maintenanceDelayMs;
        }

        public void setMaintenanceDelayMs(long maintenanceDelayMs) {
            this.maintenanceDelayMs = maintenanceDelayMs;
        }

        public int getMaxRuns() {
            return maxRuns;
        }

        public void setMaxRuns(int maxRuns) {
            this.maxRuns = maxRuns;
        }

        public Duration getHorizon() {
            return horizon;
        }

        public void setHorizon(Duration horizon) {
            this.horizon = horizon;
        }

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }

        public Duration getOrphanMinAge() {
            return orphanMinAge;
        }

        public void setOrphanMinAge(Duration orphanMinAge) {
            this.orphanMinAge = orphanMinAge;
        }

        public int getOrphanBatch() {
            return orphanBatch;
        }

        public void setOrphanBatch(int orphanBatch) {
            this.orphanBatch = orphanBatch;
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<DeploymentDef> deployments = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<DeploymentDef> getDeployments() {
            return deployments;
        }

        public void setDeployments(List<DeploymentDef> deployments) {
            this.deployments = deployments;
        }
    }

    public static class DeploymentDef {
        private String name;
        private UUID flowId;
        private List<ScheduleDef> schedules = new ArrayList<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public UUID getFlowId() {
            return flowId;
        }

        public void setFlowId(UUID flowId) {
            this.flowId = flowId;
        }

        public List<ScheduleDef> getSchedules() {
            return schedules;
        }

        public void setSchedules(List<ScheduleDef> schedules) {
            this.schedules = schedules;
        }

        @Override
        public String toString() {
            return "DeploymentDef{" +
                    "name='" + name + '\'' +
                    ", flowId=" + flowId +
                    ", schedules=" + schedules +
                    '}';
        }
    }

    /** Either {@code cron} (with optional {@code timezone}) or {@code interval} (with optional {@code anchor}). */
    public static class ScheduleDef {
        private String cron;
        private String timezone;
        private Duration interval;
        private Instant anchor;
        private boolean active = true;
        private Map<String, Object> parameters = new LinkedHashMap<>();

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Instant getAnchor() {
            return anchor;
        }

        public void setAnchor(Instant anchor) {
            this.anchor = anchor;
        }

        public boolean isActive() {
            return active;
        }

        public void setActive(boolean active) {
            this.active = active;
        }

        public Map<String, Object> getParameters() {
            return parameters;
        }

        public void setParameters(Map<String, Object> parameters) {
            this.parameters = parameters;
        }

        @Override
        public String toString() {
            return cron != null ? "cron[" + cron + " " + timezone + "]" : "interval[" + interval + " @" + anchor + "]";
        }
    }
}
