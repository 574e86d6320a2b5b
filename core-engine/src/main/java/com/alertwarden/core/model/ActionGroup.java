package com.alertwarden.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Named routing target: an ordered list of {@link Receiver}s.
 *
 * <p>
 * Instances are immutable. Registering a group under an existing id produces
 * a new {@link #getVersion() version} rather than mutating the one already
 * referenced by active rules.
 * </p>
 *
 * @since 1.0.0
 */
public final class ActionGroup {

    /** Maximum length of {@link #getShortName()}. */
    public static final int MAX_SHORT_NAME_LENGTH = 12;

    private final String id;
    private final String name;
    private final String shortName;
    private final List<Receiver> receivers;
    private final long version;

    private ActionGroup(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Action group id must not be null");
        this.name = builder.name != null ? builder.name : builder.id;
        this.shortName = builder.shortName;
        this.receivers = Collections.unmodifiableList(new ArrayList<>(builder.receivers));
        this.version = builder.version;
    }

    public static Builder builder(String id) {
        return new Builder().id(id);
    }

    /**
     * Copy this group with a different version number.
     *
     * @param newVersion version to assign
     * @return a new instance sharing everything but the version
     */
    public ActionGroup withVersion(long newVersion) {
        return new Builder()
                .id(id)
                .name(name)
                .shortName(shortName)
                .receivers(receivers)
                .version(newVersion)
                .build();
    }

    /** Fluent builder for {@link ActionGroup}. */
    public static class Builder {
        private String id;
        private String name;
        private String shortName;
        private final List<Receiver> receivers = new ArrayList<>();
        private long version = 1;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder shortName(String shortName) {
            this.shortName = shortName;
            return this;
        }

        public Builder receiver(Receiver receiver) {
            this.receivers.add(Objects.requireNonNull(receiver, "receiver must not be null"));
            return this;
        }

        public Builder receivers(List<? extends Receiver> receivers) {
            this.receivers.clear();
            receivers.forEach(this::receiver);
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public ActionGroup build() {
            return new ActionGroup(this);
        }
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getShortName() {
        return shortName;
    }

    /**
     * @return unmodifiable, ordered receiver list
     */
    public List<Receiver> getReceivers() {
        return receivers;
    }

    public long getVersion() {
        return version;
    }

    /**
     * Structural problems of this group, not counting collisions with other
     * registered groups.
     *
     * @return list of problems, empty when valid
     */
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (id.isBlank()) {
            problems.add("Action group id must not be blank");
        }
        if (shortName == null || shortName.isBlank()) {
            problems.add("Action group '" + id + "' requires a 'shortName'");
        } else if (shortName.length() > MAX_SHORT_NAME_LENGTH) {
            problems.add("Action group '" + id + "' shortName '" + shortName + "' exceeds "
                    + MAX_SHORT_NAME_LENGTH + " characters");
        }
        for (Receiver receiver : receivers) {
            for (String problem : receiver.problems()) {
                problems.add("Action group '" + id + "': " + problem);
            }
        }
        return problems;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ActionGroup that))
            return false;
        return version == that.version && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version);
    }

    @Override
    public String toString() {
        return "ActionGroup{" +
                "id='" + id + '\'' +
                ", shortName='" + shortName + '\'' +
                ", receivers=" + receivers.size() +
                ", version=" + version +
                '}';
    }
}
