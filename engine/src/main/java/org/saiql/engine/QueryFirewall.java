package org.saiql.engine;

/**
 * Hook consulted once per compilation, before validation, with the
 * normalized query text.
 *
 * <p>The compiler only consumes the verdict; pattern matching, rate limiting
 * and the like belong to the implementation.
 */
@FunctionalInterface
public interface QueryFirewall {

    FirewallVerdict inspect(String normalizedQuery);

    /**
     * A firewall that lets every query through.
     */
    static QueryFirewall allowAll() {
        return query -> FirewallVerdict.allow();
    }
}
