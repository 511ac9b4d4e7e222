package org.saiql.engine;

import java.util.Objects;

/**
 * Outcome of a {@link QueryFirewall} inspection.
 */
public sealed interface FirewallVerdict permits FirewallVerdict.Allow, FirewallVerdict.Block {

    record Allow() implements FirewallVerdict {
    }

    record Block(String reason) implements FirewallVerdict {
        public Block {
            Objects.requireNonNull(reason, "Reason cannot be null");
        }
    }

    static FirewallVerdict allow() {
        return new Allow();
    }

    static FirewallVerdict block(String reason) {
        return new Block(reason);
    }
}
