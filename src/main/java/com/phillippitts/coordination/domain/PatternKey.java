package com.phillippitts.coordination.domain;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Composite pattern key: the set of domains, the item count and the strategy label.
 *
 * <p>Domains are de-duplicated and sorted, so keys built from differently ordered domain
 * lists are equal. {@link #canonical()} renders the stored form
 * {@code domainA+domainB_<itemCount>_<strategy>}.
 */
public record PatternKey(List<String> domains, int itemCount, String strategy) {

    public PatternKey {
        domains = domains == null ? List.of() : List.copyOf(new TreeSet<>(domains));
        Objects.requireNonNull(strategy, "strategy");
    }

    public static PatternKey of(Collection<String> domains, int itemCount, String strategy) {
        return new PatternKey(domains == null ? List.of() : List.copyOf(domains), itemCount, strategy);
    }

    public String canonical() {
        return String.join("+", domains) + "_" + itemCount + "_" + strategy;
    }

    @Override
    public String toString() {
        return canonical();
    }
}
