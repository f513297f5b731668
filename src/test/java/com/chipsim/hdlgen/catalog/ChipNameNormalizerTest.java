package com.chipsim.hdlgen.catalog;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ChipNameNormalizer.
 */
class ChipNameNormalizerTest {

    private final ChipNameNormalizer normalizer = new ChipNameNormalizer(InterfaceCatalog.hackChipSet());

    @ParameterizedTest
    @CsvSource({
            "NAND, Nand",
            "MUX, Mux",
            "DMUX, DMux",
            "Mux, Mux",
            "half adder, HalfAdder",
            "HALF ADDER, HalfAdder",
            "Halfadder, HalfAdder",
            "FULL-ADDER, FullAdder",
            "mux_16, Mux16",
            "RAM-8, RAM8",
            "alu, ALU"
    })
    void testCatalogNames(String raw, String expected) {
        TypeResolution resolution = normalizer.normalize(raw);

        assertThat(resolution.isSupported()).isTrue();
        assertThat(resolution.canonicalName()).isEqualTo(expected);
        assertThat(normalizer.catalogEntry(resolution)).isPresent();
    }

    @ParameterizedTest
    @CsvSource({
            "8-1BIT",
            "1-8BIT",
            "81BIT",
            "Splitter8",
            "BUS8",
            "bus-8"
    })
    void testRemovedNamesAreUnsupported(String raw) {
        TypeResolution resolution = normalizer.normalize(raw);

        assertThat(resolution.isSupported()).isFalse();
        assertThat(resolution).isInstanceOf(TypeResolution.Unsupported.class);
        assertThat(((TypeResolution.Unsupported) resolution).getReason()).contains("sub-bus");
        assertThatThrownBy(resolution::canonicalName).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testCustomNamePassesThroughUnchanged() {
        TypeResolution resolution = normalizer.normalize("My Comparator");

        assertThat(resolution.isSupported()).isTrue();
        assertThat(resolution.canonicalName()).isEqualTo("MyComparator");
        assertThat(normalizer.catalogEntry(resolution)).isEmpty();
    }

    @Test
    void testBlankNameIsUnsupported() {
        assertThat(normalizer.normalize("  ").isSupported()).isFalse();
        assertThat(normalizer.normalize(null).isSupported()).isFalse();
    }

    @Test
    void testNormalizeIsRepeatable() {
        assertThat(normalizer.normalize("8-1BIT")).isEqualTo(normalizer.normalize("8-1BIT"));
        assertThat(normalizer.normalize("MUX")).isEqualTo(normalizer.normalize("MUX"));
    }

    @Test
    void testModuleName() {
        assertThat(normalizer.moduleName("MUX-16")).isEqualTo("MUX16");
        assertThat(normalizer.moduleName("half adder")).isEqualTo("HalfAdder");
        assertThat(normalizer.moduleName("Splitter8")).isEqualTo("Splitter8");
        assertThat(normalizer.moduleName("")).isEqualTo("UnknownChip");
    }

    @Test
    void testModuleNameIgnoresCatalogAliases() {
        assertThat(normalizer.moduleName("mux16")).isEqualTo("mux16");
        assertThat(normalizer.moduleName("NOT")).isEqualTo("NOT");
        assertThat(normalizer.normalize("NOT").canonicalName()).isEqualTo("Not");
    }
}
