package com.tessera.database.query;

import com.tessera.database.exception.ConfigurationException;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of {@link QueryMacro}s, shared by every builder a
 * {@link com.tessera.database.model.Database} creates.
 */
public final class MacroRegistry {

    private final Map<String, QueryMacro> macros = new ConcurrentHashMap<>();

    /**
     * Registers a macro under {@code name}, replacing any existing one.
     *
     * @param name  macro name, e.g. {@code "populate"}
     * @param macro the implementation
     */
    public MacroRegistry register(String name, QueryMacro macro) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (macro == null) {
            throw new IllegalArgumentException("macro must not be null");
        }
        macros.put(name, macro);
        return this;
    }

    /** Registers every macro from {@code mixin}; later registrations win. */
    public MacroRegistry mixin(Map<String, QueryMacro> mixin) {
        mixin.forEach(this::register);
        return this;
    }

    public boolean has(String name) {
        return name != null && macros.containsKey(name);
    }

    /**
     * @throws ConfigurationException if no macro is registered under {@code name}
     */
    public QueryMacro get(String name) {
        QueryMacro macro = name == null ? null : macros.get(name);
        if (macro == null) {
            throw new ConfigurationException(
                    "Macro '%s' is not registered".formatted(name), Map.of("macro", String.valueOf(name)));
        }
        return macro;
    }

    /** Registered names, sorted. */
    public Set<String> names() {
        return new TreeSet<>(macros.keySet());
    }
}
