package com.chipsim.hdlgen.lowering;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

import com.chipsim.hdlgen.model.PinAddress;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for WireIdentifierAllocator.
 */
class WireIdentifierAllocatorTest {

    @Test
    void testSameKeyReturnsSameIdentifier() {
        WireIdentifierAllocator allocator = new WireIdentifierAllocator();

        assertThat(allocator.identifierFor(10, 2)).isEqualTo("w1");
        assertThat(allocator.identifierFor(11, 0)).isEqualTo("w2");
        assertThat(allocator.identifierFor(10, 2)).isEqualTo("w1");
        assertThat(allocator.allocatedCount()).isEqualTo(2);
        assertThat(allocator.getIdentifiers()).containsExactly(
                entry(new PinAddress(10, 2), "w1"), entry(new PinAddress(11, 0), "w2"));
    }

    @Test
    void testConcurrentCallersAgreeOnIdentifier() {
        WireIdentifierAllocator allocator = new WireIdentifierAllocator();
        Set<String> seen = ConcurrentHashMap.newKeySet();

        IntStream.range(0, 1000).parallel().forEach(i -> seen.add(allocator.identifierFor(7, i % 4)));

        assertThat(seen).hasSize(4);
        assertThat(allocator.allocatedCount()).isEqualTo(4);
        assertThat(List.copyOf(allocator.getIdentifiers().values()))
                .containsExactly("w1", "w2", "w3", "w4");
    }
}
