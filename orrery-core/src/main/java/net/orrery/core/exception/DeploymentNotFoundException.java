package net.orrery.core.exception;

import java.util.UUID;

public class DeploymentNotFoundException extends OrreryException {
    private final UUID deploymentId;

    public DeploymentNotFoundException(UUID deploymentId) {
        super("Deployment not found: " + deploymentId);
        this.deploymentId = deploymentId;
    }

    public UUID getDeploymentId() {
        return deploymentId;
    }
}
