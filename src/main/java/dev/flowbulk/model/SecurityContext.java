package dev.flowbulk.model;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The run mode of a workflow and the object access its record operations need.
 * Permissions read {@code <Operation>_<Object>}, for example {@code Create_Account}.
 */
public record SecurityContext(
    String runInMode, // nullable
    boolean systemMode,
    boolean enforceObjectPermissions,
    boolean enforceFieldPermissions,
    boolean enforceSharingRules,
    Set<String> requiredPermissions,
    Set<String> requiredObjects,
    Map<String, Set<String>> requiredFields
) {
    public SecurityContext {
        requiredPermissions = Collections.unmodifiableSet(new TreeSet<>(requiredPermissions));
        requiredObjects = Collections.unmodifiableSet(new TreeSet<>(requiredObjects));
        var fields = new TreeMap<String, Set<String>>();
        requiredFields.forEach((object, names) ->
            fields.put(object, Collections.unmodifiableSet(new TreeSet<>(names))));
        requiredFields = Collections.unmodifiableMap(fields);
    }

    public static SecurityContext none() {
        return new SecurityContext(null, false, false, false, false, Set.of(), Set.of(), Map.of());
    }
}
