package io.schemadrift.core.engine;

import io.schemadrift.core.model.EnumsSimilarConfig;
import io.schemadrift.core.schema.Feature;
import io.schemadrift.core.schema.FeatureStore;
import io.schemadrift.core.schema.StringDomain;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Groups string domains whose value sets are near-duplicates.
 *
 * <p>Two domains are similar when both hold at least {@link EnumsSimilarConfig#minCount()} values
 * and their Jaccard similarity reaches {@link EnumsSimilarConfig#minJaccardSimilarity()}.
 * Clusters are the connected components of that relation, so similarity is applied
 * transitively.
 */
public final class DomainSimilarityClusterer {

    /**
     * Returns every cluster of two or more similar domains. Each cluster is sorted by name and
     * clusters are ordered by their first name.
     */
    public List<SortedSet<String>> similarDomains(Collection<StringDomain> domains, EnumsSimilarConfig config) {
        List<StringDomain> candidates = domains.stream()
                .filter(d -> d.size() > 0 && d.size() >= config.minCount())
                .sorted(Comparator.comparing(StringDomain::name))
                .toList();

        Map<String, String> parent = new HashMap<>();
        candidates.forEach(d -> parent.put(d.name(), d.name()));
        for (int i = 0; i < candidates.size(); i++) {
            for (int j = i + 1; j < candidates.size(); j++) {
                StringDomain a = candidates.get(i);
                StringDomain b = candidates.get(j);
                if (jaccard(a.values(), b.values()) >= config.minJaccardSimilarity()) {
                    union(parent, a.name(), b.name());
                }
            }
        }

        Map<String, SortedSet<String>> components = new TreeMap<>();
        for (StringDomain domain : candidates) {
            components.computeIfAbsent(find(parent, domain.name()), k -> new TreeSet<>()).add(domain.name());
        }
        List<SortedSet<String>> clusters = new ArrayList<>();
        for (SortedSet<String> component : components.values()) {
            if (component.size() > 1) {
                clusters.add(component);
            }
        }
        clusters.sort(Comparator.comparing(cluster -> cluster.first()));
        return clusters;
    }

    /** Maps each domain name to the names of the features referencing it. */
    public Map<String, SortedSet<String>> domainToColumns(FeatureStore features) {
        Map<String, SortedSet<String>> result = new TreeMap<>();
        for (Feature feature : features.features()) {
            feature.domain().ifPresent(domain -> result.computeIfAbsent(domain, k -> new TreeSet<>())
                    .add(feature.name()));
        }
        return result;
    }

    /** {@code |a ∩ b| / |a ∪ b|}; 0 when both sets are empty. */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        long intersection = a.stream().filter(b::contains).count();
        long union = a.size() + b.size() - intersection;
        return (double) intersection / union;
    }

    private static String find(Map<String, String> parent, String name) {
        String root = name;
        while (!parent.get(root).equals(root)) {
            root = parent.get(root);
        }
        // path compression
        String current = name;
        while (!current.equals(root)) {
            String next = parent.get(current);
            parent.put(current, root);
            current = next;
        }
        return root;
    }

    private static void union(Map<String, String> parent, String a, String b) {
        String rootA = find(parent, a);
        String rootB = find(parent, b);
        if (!rootA.equals(rootB)) {
            // smaller name becomes the root
            if (rootA.compareTo(rootB) < 0) {
                parent.put(rootB, rootA);
            } else {
                parent.put(rootA, rootB);
            }
        }
    }
}
