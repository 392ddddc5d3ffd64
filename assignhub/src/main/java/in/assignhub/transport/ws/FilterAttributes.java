package in.assignhub.transport.ws;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Attribute names a subscription may filter on.
 */
public final class FilterAttributes {

    private final Set<String> names;

    public FilterAttributes(Collection<String> names) {
        this.names = Set.copyOf(names);
    }

    public Set<String> names() {
        return names;
    }

    public boolean isRecognized(String name) {
        return names.contains(name);
    }

    /**
     * Keys of {@code filters} that are not recognized, sorted.
     */
    public Set<String> unknownKeys(Map<String, String> filters) {
        Set<String> unknown = new TreeSet<>();
        for (String key : filters.keySet()) {
            if (!names.contains(key)) {
                unknown.add(key);
            }
        }
        return unknown;
    }
}
