package com.pseudo.buster.synonym;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Read-only mapping from canonical identifier names to their known alias spellings.
 *
 * Built once and shared by every line of a run. Three indexes are derived at
 * construction time:
 * - exact alias spelling to canonical name
 * - lowercased alias to canonical name (the alias index)
 * - lowercased canonical names
 *
 * Aliases are not required to be unique across canonical entries. When two
 * entries claim the same spelling the entry registered first keeps it and the
 * collision is logged.
 */
public final class SynonymTable {

    private static final Logger logger = LoggerFactory.getLogger(SynonymTable.class);

    private final Map<String, List<String>> entries;

    // alias spelling as registered -> canonical name
    private final Map<String, String> exactIndex;

    // lowercased alias -> canonical name
    private final Map<String, String> aliasIndex;

    private final Set<String> canonicalNames;

    private SynonymTable(Map<String, Set<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        Map<String, String> exact = new HashMap<>();
        Map<String, String> lower = new HashMap<>();
        Set<String> canonical = new LinkedHashSet<>();

        for (Map.Entry<String, Set<String>> entry : source.entrySet()) {
            String canon = entry.getKey();
            copy.put(canon, List.copyOf(entry.getValue()));
            canonical.add(canon.toLowerCase(Locale.ROOT));

            // A canonical name always resolves to itself
            register(exact, lower, canon, canon);
            for (String alias : entry.getValue()) {
                register(exact, lower, alias, canon);
            }
        }

        this.entries = Collections.unmodifiableMap(copy);
        this.exactIndex = Map.copyOf(exact);
        this.aliasIndex = Map.copyOf(lower);
        this.canonicalNames = Collections.unmodifiableSet(canonical);

        logger.debug("Synonym table built: {} canonical names, {} alias spellings",
                entries.size(), aliasIndex.size());
    }

    private static void register(Map<String, String> exact, Map<String, String> lower,
                                 String alias, String canon) {
        String key = alias.toLowerCase(Locale.ROOT);
        String existing = lower.putIfAbsent(key, canon);
        if (existing != null && !existing.equals(canon)) {
            logger.warn("Alias '{}' is claimed by both '{}' and '{}'; keeping '{}'",
                    alias, existing, canon, existing);
            return;
        }
        exact.putIfAbsent(alias, canon);
    }

    /**
     * Resolves an alias to its registered canonical name.
     * Lookup order:
     * 1. exact match against a registered spelling
     * 2. exact match of the snake_case form of the alias
     * 3. case-insensitive match
     *
     * @param alias The identifier as written, optionally quoted
     * @return The canonical name, or empty if the identifier is not registered
     */
    public Optional<String> lookup(String alias) {
        Objects.requireNonNull(alias, "alias");
        String value = IdentifierCanonicalizer.unquote(alias);
        if (value.isEmpty()) {
            return Optional.empty();
        }

        String canon = exactIndex.get(value);
        if (canon == null) {
            canon = exactIndex.get(IdentifierCanonicalizer.toSnakeCase(value));
        }
        if (canon == null) {
            canon = aliasIndex.get(value.toLowerCase(Locale.ROOT));
        }
        return Optional.ofNullable(canon);
    }

    /**
     * Returns the canonical name of a registered alias, or the case-style
     * canonical form of an unregistered identifier. Never fails.
     */
    public String canonicalize(String identifier) {
        return lookup(identifier)
                .orElseGet(() -> IdentifierCanonicalizer.toSnakeCase(IdentifierCanonicalizer.unquote(identifier)));
    }

    /**
     * Checks whether a token is a canonical name or a registered alias, ignoring case.
     */
    public boolean isKnown(String token) {
        String key = token.toLowerCase(Locale.ROOT);
        return canonicalNames.contains(key) || aliasIndex.containsKey(key);
    }

    /**
     * Canonical names with their alias spellings, in registration order.
     */
    public Map<String, List<String>> getEntries() {
        return entries;
    }

    /**
     * Lowercased alias to canonical name for every registered spelling.
     */
    public Map<String, String> getAliasIndex() {
        return aliasIndex;
    }

    public Set<String> getCanonicalNames() {
        return entries.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, Set<String>> entries = new LinkedHashMap<>();

        /**
         * Registers aliases for a canonical name. Repeated calls for the same
         * name append to its alias list.
         */
        public Builder add(String canonicalName, String... aliases) {
            return add(canonicalName, Arrays.asList(aliases));
        }

        public Builder add(String canonicalName, Collection<String> aliases) {
            if (canonicalName == null || canonicalName.isBlank()) {
                throw new IllegalArgumentException("Canonical name must not be blank");
            }
            Set<String> target = entries.computeIfAbsent(canonicalName, k -> new LinkedHashSet<>());
            for (String alias : aliases) {
                if (alias != null && !alias.isBlank()) {
                    target.add(alias);
                }
            }
            return this;
        }

        public SynonymTable build() {
            return new SynonymTable(entries);
        }
    }
}
