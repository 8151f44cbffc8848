package burst.fleet.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Groups to launch, keyed by unique group name. Built once, read-only afterwards.
 */
public final class FleetPlan {

    /** One group of the plan: how each machine looks and how many of them. */
    public record Group(MachineSetup setup, int count) {
        public Group {
            Objects.requireNonNull(setup, "setup is required");
            if (count <= 0) {
                throw new IllegalArgumentException("count must be positive");
            }
        }
    }

    private final Map<String, Group> groups;

    private FleetPlan(Map<String, Group> groups) {
        this.groups = Collections.unmodifiableMap(new LinkedHashMap<>(groups));
    }

    public Map<String, Group> groups() {
        return groups;
    }

    public Set<String> groupNames() {
        return groups.keySet();
    }

    public Group group(String name) {
        Group g = groups.get(name);
        if (g == null) {
            throw new IllegalArgumentException("Unknown group: " + name);
        }
        return g;
    }

    public int totalInstances() {
        int total = 0;
        for (Group g : groups.values()) {
            total += g.count();
        }
        return total;
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, Group> groups = new LinkedHashMap<>();

        public Builder add(String name, int count, MachineSetup setup) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("group name is required");
            }
            if (groups.containsKey(name)) {
                throw new IllegalArgumentException("group name already in use: " + name);
            }
            groups.put(name, new Group(setup, count));
            return this;
        }

        public FleetPlan build() {
            return new FleetPlan(groups);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("FleetPlan{");
        groups.forEach((name, g) -> sb.append(name).append('x').append(g.count()).append(' '));
        return sb.toString().trim() + "}";
    }
}
