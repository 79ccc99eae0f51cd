package tech.notifyrelay.notify.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The fixed set of channel names relayed by a deployment.
 *
 * <p>The relay process and every worker must be configured with the same set; there is
 * no channel discovery at runtime. Names are restricted to lowercase SQL identifiers
 * because they are interpolated into {@code LISTEN} statements.</p>
 */
public final class ChannelSet implements Iterable<String> {

    private static final Pattern CHANNEL_NAME = Pattern.compile("[a-z_][a-z0-9_]{0,62}");

    /**
     * Channels emitted by the scoreboard database triggers.
     */
    public static final List<String> DEFAULT_CHANNELS = List.of(
        "matchdata_change",
        "match_change",
        "scoreboard_change",
        "playclock_change",
        "gameclock_change",
        "football_event_change",
        "player_match_change"
    );

    private final Set<String> names;

    private ChannelSet(Set<String> names) {
        this.names = names;
    }

    public static ChannelSet of(String... names) {
        return of(List.of(names));
    }

    public static ChannelSet of(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            throw new IllegalArgumentException("Channel set must not be empty");
        }
        Set<String> validated = new LinkedHashSet<>();
        for (String name : names) {
            if (name == null || !CHANNEL_NAME.matcher(name).matches()) {
                throw new IllegalArgumentException("Invalid channel name: " + name);
            }
            validated.add(name);
        }
        return new ChannelSet(Collections.unmodifiableSet(validated));
    }

    public static ChannelSet defaults() {
        return of(DEFAULT_CHANNELS);
    }

    public boolean contains(String channel) {
        return names.contains(channel);
    }

    /**
     * Returns the requested channels, failing on any name outside this set.
     */
    public Set<String> require(Collection<String> requested) {
        if (requested == null || requested.isEmpty()) {
            throw new IllegalArgumentException("At least one channel must be requested");
        }
        Set<String> result = new LinkedHashSet<>();
        for (String channel : requested) {
            if (!names.contains(channel)) {
                throw new IllegalArgumentException("Unknown channel: " + channel);
            }
            result.add(channel);
        }
        return Collections.unmodifiableSet(result);
    }

    public Set<String> names() {
        return names;
    }

    public int size() {
        return names.size();
    }

    @Override
    public Iterator<String> iterator() {
        return names.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChannelSet other)) return false;
        return names.equals(other.names);
    }

    @Override
    public int hashCode() {
        return names.hashCode();
    }

    @Override
    public String toString() {
        return names.toString();
    }
}
