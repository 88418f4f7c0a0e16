package com.geico.poc.kqlcompiler.transpiler;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Column visibility at one position of the pipeline.
 *
 * An empty visible set means every source column is visible. Names introduced by
 * extend or summarize are aliases; for those the context also remembers the SQL that
 * defines them, so predicates and bare column references can inline it. Function and
 * arithmetic fragments are rendered by the normalizer and keep plain column names.
 *
 * Immutable. Each operator returns a new context; nothing is shared between compilations.
 */
public final class CompilationContext {

    private static final CompilationContext INITIAL =
            new CompilationContext(Collections.<String>emptySet(), Collections.<String, String>emptyMap(), false);

    private final Set<String> visibleColumns;
    private final Map<String, String> aliases;
    private final boolean grouped;

    private CompilationContext(Set<String> visibleColumns, Map<String, String> aliases, boolean grouped) {
        this.visibleColumns = visibleColumns;
        this.aliases = aliases;
        this.grouped = grouped;
    }

    public static CompilationContext initial() {
        return INITIAL;
    }

    public boolean isAllColumnsVisible() {
        return visibleColumns.isEmpty();
    }

    public Set<String> getVisibleColumns() {
        return visibleColumns;
    }

    public boolean isVisible(String name) {
        return visibleColumns.isEmpty() ? !grouped : visibleColumns.contains(name);
    }

    /**
     * True when {@code name} was introduced by extend or summarize and is still visible.
     */
    public boolean isAlias(String name) {
        return aliases.containsKey(name);
    }

    /**
     * SQL defining an alias, or null when {@code name} is not one.
     */
    public String aliasSql(String name) {
        return aliases.get(name);
    }

    /**
     * True after a summarize: predicates now filter groups.
     */
    public boolean isGrouped() {
        return grouped;
    }

    /**
     * Add computed columns to whatever is already visible.
     */
    public CompilationContext withExtended(Map<String, String> computed) {
        Set<String> visible = new LinkedHashSet<>(visibleColumns);
        if (!visible.isEmpty()) {
            visible.addAll(computed.keySet());
        }
        Map<String, String> merged = new LinkedHashMap<>(aliases);
        merged.putAll(computed);
        return new CompilationContext(freeze(visible), freeze(merged), grouped);
    }

    /**
     * Visible set becomes exactly the group keys and aggregates of a summarize.
     */
    public CompilationContext withSummarized(Map<String, String> outputs) {
        Set<String> visible = new LinkedHashSet<>(outputs.keySet());
        return new CompilationContext(freeze(visible), freeze(new LinkedHashMap<>(outputs)), true);
    }

    /**
     * Visible set narrowed to {@code columns}; aliases outside it are forgotten.
     */
    public CompilationContext withProjected(Collection<String> columns) {
        Set<String> visible = new LinkedHashSet<>(columns);
        Map<String, String> kept = new LinkedHashMap<>();
        for (Map.Entry<String, String> alias : aliases.entrySet()) {
            if (visible.contains(alias.getKey())) {
                kept.put(alias.getKey(), alias.getValue());
            }
        }
        return new CompilationContext(freeze(visible), freeze(kept), grouped);
    }

    private static <T> Set<T> freeze(Set<T> set) {
        return Collections.unmodifiableSet(set);
    }

    private static <K, V> Map<K, V> freeze(Map<K, V> map) {
        return Collections.unmodifiableMap(map);
    }

    @Override
    public String toString() {
        return "CompilationContext{visible=" + (visibleColumns.isEmpty() ? "*" : visibleColumns)
                + ", aliases=" + aliases.keySet() + ", grouped=" + grouped + "}";
    }
}
