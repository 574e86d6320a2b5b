package com.alertwarden.core.registry;

import com.alertwarden.core.model.ActionGroup;
import com.alertwarden.core.model.Receiver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Stores action groups and resolves the receivers of a rule.
 *
 * <h3>Concurrency</h3>
 * <p>
 * Reads go to a volatile, immutable {@link RoutingTable} and need no locking.
 * Writes are serialized on an internal lock, build a new table and publish it
 * in one step (copy-on-write). Callers that must see a consistent view across
 * several lookups take a {@link #snapshot()} first.
 * </p>
 *
 * <h3>Versioning</h3>
 * <p>
 * Registering a group under an id that already exists stores it as the next
 * version of that id. The previous version stays reachable through any
 * snapshot taken before the update.
 * </p>
 *
 * @since 1.0.0
 */
public class ActionGroupRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ActionGroupRegistry.class);

    private final Object writeLock = new Object();
    private volatile RoutingTable table = RoutingTable.EMPTY;

    /**
     * Register (or update) a single action group.
     *
     * @param group group to register; must not be {@code null}
     * @return the stored group, carrying its assigned version
     * @throws ValidationException if the group is malformed or its short name
     *                             is used by another group
     */
    public ActionGroup register(ActionGroup group) {
        Objects.requireNonNull(group, "ActionGroup must not be null");
        synchronized (writeLock) {
            RoutingTable current = table;
            Map<String, ActionGroup> groups = new LinkedHashMap<>(current.getGroups());
            ActionGroup stored = versioned(group, current);
            groups.put(stored.getId(), stored);

            List<String> problems = new ArrayList<>(group.problems());
            problems.addAll(shortNameCollisions(groups.values()));
            if (!problems.isEmpty()) {
                throw new ValidationException(problems);
            }

            publish(new RoutingTable(current.getVersion() + 1, groups, current.getEscalations()));
            LOG.info("Registered action group '{}' version {} with {} receiver(s)",
                    stored.getId(), stored.getVersion(), stored.getReceivers().size());
            return stored;
        }
    }

    /**
     * Replace the whole registry content in one step.
     *
     * <p>
     * Groups whose id already exists become a new version of that id unless
     * they are unchanged. Groups not present in {@code groups} are dropped from
     * the new table.
     * </p>
     *
     * @param groups      full set of groups
     * @param escalations severity to additional action group ids
     * @return the published table
     * @throws ValidationException if any group is malformed, short names
     *                             collide or an escalation target is unknown;
     *                             nothing is published in that case
     */
    public RoutingTable replaceAll(Collection<ActionGroup> groups, Map<Integer, List<String>> escalations) {
        Objects.requireNonNull(groups, "Action groups must not be null");
        Objects.requireNonNull(escalations, "Escalations must not be null");
        synchronized (writeLock) {
            RoutingTable current = table;
            Map<String, ActionGroup> next = new LinkedHashMap<>();
            List<String> problems = new ArrayList<>();
            for (ActionGroup group : groups) {
                problems.addAll(group.problems());
                if (next.containsKey(group.getId())) {
                    problems.add("Duplicate action group id '" + group.getId() + "'");
                }
                next.put(group.getId(), versioned(group, current));
            }
            problems.addAll(shortNameCollisions(next.values()));
            escalations.forEach((severity, ids) -> ids.stream()
                    .filter(id -> !next.containsKey(id))
                    .forEach(id -> problems.add("Escalation for severity " + severity
                            + " references unknown action group '" + id + "'")));
            if (!problems.isEmpty()) {
                throw new ValidationException(problems);
            }

            RoutingTable published = new RoutingTable(current.getVersion() + 1, next, escalations);
            publish(published);
            LOG.info("Action group registry now at version {} with {} group(s)",
                    published.getVersion(), next.size());
            return published;
        }
    }

    /**
     * @param id action group id
     * @return the current version of the group
     * @throws ActionGroupNotFoundException if absent
     */
    public ActionGroup resolve(String id) {
        return table.resolve(id);
    }

    /**
     * Receivers to notify for a rule with the given severity and action group
     * references, against the current table.
     *
     * @see RoutingTable#listReceiversFor(int, Collection)
     */
    public List<Receiver> listReceiversFor(int severity, Collection<String> actionGroupIds) {
        return table.listReceiversFor(severity, actionGroupIds);
    }

    /**
     * @return the current immutable table
     */
    public RoutingTable snapshot() {
        return table;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void publish(RoutingTable next) {
        table = next;
    }

    private static ActionGroup versioned(ActionGroup group, RoutingTable current) {
        ActionGroup existing = current.getGroups().get(group.getId());
        if (existing == null) {
            return group.withVersion(1);
        }
        if (sameContent(existing, group)) {
            return existing;
        }
        return group.withVersion(existing.getVersion() + 1);
    }

    private static boolean sameContent(ActionGroup a, ActionGroup b) {
        return Objects.equals(a.getShortName(), b.getShortName())
                && Objects.equals(a.getName(), b.getName())
                && a.getReceivers().equals(b.getReceivers());
    }

    private static List<String> shortNameCollisions(Collection<ActionGroup> groups) {
        List<String> problems = new ArrayList<>();
        Map<String, String> owners = new LinkedHashMap<>();
        for (ActionGroup group : groups) {
            if (group.getShortName() == null) {
                continue;
            }
            String owner = owners.putIfAbsent(group.getShortName().toLowerCase(Locale.ROOT), group.getId());
            if (owner != null && !owner.equals(group.getId())) {
                problems.add("Action group '" + group.getId() + "' shortName '" + group.getShortName()
                        + "' collides with action group '" + owner + "'");
            }
        }
        return problems;
    }
}
