package com.chipsim.hdlgen.catalog;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps raw Digital Logic Sim chip names onto catalog names.
 *
 * Stateless: callers that need one warning per instance must memoize the
 * result themselves.
 */
public class ChipNameNormalizer {

    private static final String BUS_HELPER_REASON =
            "bus helper chip has no Hack equivalent, use sub-bus addressing instead";

    /** Legacy simulator names, keyed upper-case. */
    private static final Map<String, String> LEGACY_ALIASES = Map.of(
            "NAND", "Nand",
            "NOT", "Not",
            "AND", "And",
            "OR", "Or",
            "XOR", "Xor",
            "MUX", "Mux",
            "DMUX", "DMux",
            "HALFADDER", "HalfAdder",
            "FULLADDER", "FullAdder");

    /** Names with no catalog equivalent, keyed upper-case, raw and stripped forms. */
    private static final Map<String, String> REMOVED = Map.of(
            "8-1BIT", BUS_HELPER_REASON,
            "81BIT", BUS_HELPER_REASON,
            "1-8BIT", BUS_HELPER_REASON,
            "18BIT", BUS_HELPER_REASON,
            "SPLITTER8", BUS_HELPER_REASON,
            "BUS8", BUS_HELPER_REASON);

    private final InterfaceCatalog catalog;
    private final Map<String, String> aliases = new HashMap<>();

    public ChipNameNormalizer(InterfaceCatalog catalog) {
        this.catalog = catalog;
        for (ChipInterface chip : catalog.getChips()) {
            aliases.put(chip.getName().toUpperCase(Locale.ROOT), chip.getName());
        }
        aliases.putAll(LEGACY_ALIASES);
    }

    public TypeResolution normalize(String rawName) {
        if (rawName == null || rawName.isBlank()) {
            return TypeResolution.unsupported("", "chip has no type name");
        }

        String removedReason = REMOVED.get(rawName.trim().toUpperCase(Locale.ROOT));
        if (removedReason != null) {
            return TypeResolution.unsupported(rawName.trim(), removedReason);
        }

        String name = stripSeparators(joinWords(rawName.trim()));

        removedReason = REMOVED.get(name.toUpperCase(Locale.ROOT));
        if (removedReason != null) {
            return TypeResolution.unsupported(name, removedReason);
        }

        String alias = aliases.get(name.toUpperCase(Locale.ROOT));
        return TypeResolution.canonical(alias != null ? alias : name);
    }

    /**
     * Catalog entry for a resolution, empty for unsupported and custom types.
     */
    public Optional<ChipInterface> catalogEntry(TypeResolution resolution) {
        if (!resolution.isSupported()) {
            return Optional.empty();
        }
        return catalog.lookup(resolution.canonicalName());
    }

    /**
     * Module name for the enclosing chip: words joined and separators stripped,
     * without catalog aliasing, so a user chip never takes a built-in's name.
     */
    public String moduleName(String rawName) {
        if (rawName == null || rawName.isBlank()) {
            return "UnknownChip";
        }
        return stripSeparators(joinWords(rawName.trim()));
    }

    static String joinWords(String name) {
        String[] parts = name.split("\\s+");
        if (parts.length == 1) {
            return name;
        }
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            sb.append(part.substring(0, 1).toUpperCase(Locale.ROOT))
                    .append(part.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    static String stripSeparators(String name) {
        return name.replace("-", "").replace("_", "");
    }
}
