package burst.fleet.model;

import java.util.List;
import java.util.Map;

/**
 * Caller logic that receives the fully set-up fleet, keyed by group name.
 */
@FunctionalInterface
public interface FleetCallback {

    void run(Map<String, List<FleetInstance>> fleet) throws Exception;
}
