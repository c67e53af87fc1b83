package io.schemadrift.core.schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the schema's named string domains.
 *
 * <p>Lookup is by exact name: no case folding, no fuzzy matching. When a new domain's candidate
 * name is already taken, the smallest integer suffix {@code >= 2} that yields an unused name is
 * appended ({@code foo} taken: {@code foo2}, then {@code foo3}, ...). The first domain created
 * under a name keeps it unsuffixed.
 *
 * <p>Value sets only grow. Not thread-safe: name resolution is order-sensitive, so callers that
 * create domains from several threads must serialize access.
 */
public final class DomainRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(DomainRegistry.class);

    private final Map<String, StringDomain> domains = new TreeMap<>();

    /** Returns the domain with exactly this name, if any. */
    public Optional<StringDomain> get(String name) {
        return Optional.ofNullable(domains.get(name));
    }

    public boolean contains(String name) {
        return domains.containsKey(name);
    }

    /**
     * Returns the domain named {@code candidateName} if it exists and holds exactly
     * {@code values}; otherwise creates a new domain under a unique name derived from
     * {@code candidateName}.
     */
    public StringDomain getOrCreate(String candidateName, Collection<String> values) {
        StringDomain existing = domains.get(candidateName);
        if (existing != null && existing.values().equals(Set.copyOf(values))) {
            return existing;
        }
        return create(candidateName, values, Set.of());
    }

    /**
     * Creates a new domain. The name is {@code candidateName} unless it is taken by an existing
     * domain or listed in {@code reservedNames}, in which case a numeric suffix is appended.
     */
    public StringDomain create(String candidateName, Collection<String> values, Set<String> reservedNames) {
        String name = uniqueName(candidateName, reservedNames);
        StringDomain domain = new StringDomain(name, values);
        domains.put(name, domain);
        LOG.debug("domain.created name={} candidate={} values={}", name, candidateName, domain.size());
        return domain;
    }

    /**
     * Returns the domain with exactly this name, creating it empty if absent. Used for shared
     * domains that several columns are routed to by name.
     */
    public StringDomain getOrCreateShared(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return domains.computeIfAbsent(name, n -> {
            LOG.debug("domain.created name={} shared=true", n);
            return new StringDomain(n, List.of());
        });
    }

    /**
     * Registers a domain under exactly the given name, as read from a schema document.
     *
     * @throws IllegalStateException if the name is already registered
     */
    StringDomain register(String name, Collection<String> values) {
        if (domains.containsKey(name)) {
            throw new IllegalStateException("Domain already registered: '" + name + "'");
        }
        StringDomain domain = new StringDomain(name, values);
        domains.put(name, domain);
        return domain;
    }

    /**
     * Adds every value of {@code newValues} not yet in {@code domain}, keeping existing values.
     *
     * @return the values actually added, in the order they were first seen
     * @throws IllegalArgumentException if {@code domain} is not owned by this registry
     */
    public List<String> extendValues(StringDomain domain, Collection<String> newValues) {
        if (domains.get(domain.name()) != domain) {
            throw new IllegalArgumentException("Domain '" + domain.name() + "' is not owned by this registry");
        }
        List<String> added = new ArrayList<>();
        for (String value : newValues) {
            if (domain.add(value)) {
                added.add(value);
            }
        }
        if (!added.isEmpty()) {
            LOG.debug("domain.extended name={} added={} size={}", domain.name(), added.size(), domain.size());
        }
        return added;
    }

    /** The first name of {@code candidate}, {@code candidate2}, {@code candidate3}, ... that is unused. */
    public String uniqueName(String candidate, Set<String> reservedNames) {
        if (!isTaken(candidate, reservedNames)) {
            return candidate;
        }
        int suffix = 2;
        while (isTaken(candidate + suffix, reservedNames)) {
            suffix++;
        }
        return candidate + suffix;
    }

    private boolean isTaken(String name, Set<String> reservedNames) {
        return domains.containsKey(name) || reservedNames.contains(name);
    }

    /** All domains, sorted by name. */
    public Collection<StringDomain> domains() {
        return Collections.unmodifiableCollection(domains.values());
    }

    public int size() {
        return domains.size();
    }

    public boolean isEmpty() {
        return domains.isEmpty();
    }

    public void clear() {
        domains.clear();
    }

    void transferFrom(DomainRegistry other) {
        domains.clear();
        domains.putAll(other.domains);
        other.domains.clear();
    }
}
