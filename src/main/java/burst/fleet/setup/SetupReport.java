package burst.fleet.setup;

import burst.error.BurstException;

import java.util.List;

/**
 * Result of the setup fan-out. Errors are in no particular order.
 */
public record SetupReport(int attempted, List<BurstException> errors) {

    public SetupReport {
        errors = List.copyOf(errors);
    }

    public boolean isClean() {
        return errors.isEmpty();
    }
}
