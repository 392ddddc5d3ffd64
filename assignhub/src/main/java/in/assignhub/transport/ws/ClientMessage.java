package in.assignhub.transport.ws;

import java.util.Map;

/**
 * Parsed client command.
 */
public record ClientMessage(Type type, Map<String, String> filters) {

    public enum Type {
        SUBSCRIBE("subscribe"),
        UNSUBSCRIBE("unsubscribe"),
        PING("ping");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        static Type fromWire(String name) {
            for (Type t : values()) {
                if (t.wireName.equals(name)) {
                    return t;
                }
            }
            return null;
        }
    }

    public ClientMessage {
        filters = filters == null ? Map.of() : Map.copyOf(filters);
    }
}
