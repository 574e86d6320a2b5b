package com.alertwarden.core.registry;

import com.alertwarden.core.model.ActionGroup;
import com.alertwarden.core.model.Receiver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of the {@link ActionGroupRegistry}.
 *
 * <p>
 * Readers hold on to the snapshot they obtained; later registrations publish a
 * new table and never change this one, so an evaluation that started before
 * an update routes against the groups it started with.
 * </p>
 *
 * @since 1.0.0
 */
public final class RoutingTable {

    static final RoutingTable EMPTY = new RoutingTable(0, Map.of(), Map.of());

    private final long version;
    private final Map<String, ActionGroup> groups;
    private final Map<Integer, List<String>> escalations;

    RoutingTable(long version, Map<String, ActionGroup> groups, Map<Integer, List<String>> escalations) {
        this.version = version;
        this.groups = Collections.unmodifiableMap(new LinkedHashMap<>(groups));
        Map<Integer, List<String>> copy = new LinkedHashMap<>();
        escalations.forEach((severity, ids) -> copy.put(severity, List.copyOf(ids)));
        this.escalations = Collections.unmodifiableMap(copy);
    }

    /**
     * @return registry version this snapshot was published as
     */
    public long getVersion() {
        return version;
    }

    public Map<String, ActionGroup> getGroups() {
        return groups;
    }

    public Map<Integer, List<String>> getEscalations() {
        return escalations;
    }

    public Optional<ActionGroup> find(String id) {
        return Optional.ofNullable(groups.get(id));
    }

    /**
     * @param id action group id
     * @return the group
     * @throws ActionGroupNotFoundException if absent
     */
    public ActionGroup resolve(String id) {
        ActionGroup group = groups.get(id);
        if (group == null) {
            throw new ActionGroupNotFoundException(id);
        }
        return group;
    }

    /**
     * Union of receivers across the referenced groups, followed by the
     * escalation groups configured for {@code severity}.
     *
     * <p>
     * Duplicates are removed keeping the first occurrence, so a receiver
     * reachable through several groups appears once.
     * </p>
     *
     * @param severity       rule severity
     * @param actionGroupIds the rule's action group references
     * @return ordered, de-duplicated receivers
     * @throws ActionGroupNotFoundException if any referenced group is absent
     */
    public List<Receiver> listReceiversFor(int severity, Collection<String> actionGroupIds) {
        Set<String> ids = new LinkedHashSet<>(actionGroupIds);
        ids.addAll(escalations.getOrDefault(severity, List.of()));

        Set<Receiver> receivers = new LinkedHashSet<>();
        for (String id : ids) {
            receivers.addAll(resolve(id).getReceivers());
        }
        return Collections.unmodifiableList(new ArrayList<>(receivers));
    }

    @Override
    public String toString() {
        return "RoutingTable{version=" + version + ", groups=" + groups.keySet()
                + ", escalations=" + escalations + '}';
    }
}
