package in.assignhub.transport.ws;

import java.util.Map;

/**
 * Decides whether an event reaches a subscriber.
 *
 * An empty filter matches everything. Otherwise every filter key must be present in the
 * event attributes with an equal value; a missing attribute never matches.
 */
public final class SubscriptionFilterMatcher {

    public static boolean matches(Map<String, String> filters, Map<String, String> attributes) {
        if (filters == null || filters.isEmpty()) {
            return true;
        }
        if (attributes == null || attributes.isEmpty()) {
            return false;
        }
        for (Map.Entry<String, String> f : filters.entrySet()) {
            String actual = attributes.get(f.getKey());
            if (actual == null || !actual.equals(f.getValue())) {
                return false;
            }
        }
        return true;
    }

    private SubscriptionFilterMatcher() {}
}
