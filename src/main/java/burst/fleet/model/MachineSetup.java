package burst.fleet.model;

import java.util.Objects;

/**
 * Immutable description of the machines in one group: what to launch and how to set it up.
 */
public final class MachineSetup {
    private final String instanceType;
    private final String imageId;
    private final SetupRoutine setup;

    public MachineSetup(String instanceType, String imageId, SetupRoutine setup) {
        if (instanceType == null || instanceType.isBlank()) {
            throw new IllegalArgumentException("instanceType is required");
        }
        if (imageId == null || imageId.isBlank()) {
            throw new IllegalArgumentException("imageId is required");
        }
        this.instanceType = instanceType;
        this.imageId = imageId;
        this.setup = Objects.requireNonNull(setup, "setup routine is required");
    }

    public String instanceType() {
        return instanceType;
    }

    public String imageId() {
        return imageId;
    }

    public SetupRoutine setup() {
        return setup;
    }

    @Override
    public String toString() {
        return "MachineSetup{instanceType='" + instanceType + "', imageId='" + imageId + "'}";
    }
}
