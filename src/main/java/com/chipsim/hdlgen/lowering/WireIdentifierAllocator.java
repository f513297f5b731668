package com.chipsim.hdlgen.lowering;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import com.chipsim.hdlgen.model.PinAddress;

/**
 * Hands out internal signal names {@code w1, w2, ...} per instance output pin.
 *
 * An identifier, once assigned to a key, is never reallocated; every caller
 * asking for the same key gets the same string. Safe for concurrent use: the
 * first writer for a key wins.
 */
public class WireIdentifierAllocator {

    private static final String PREFIX = "w";

    private final AtomicInteger counter = new AtomicInteger();
    private final Map<PinAddress, Integer> numbers = new ConcurrentHashMap<>();

    public String identifierFor(int instanceId, int pinId) {
        int number = numbers.computeIfAbsent(new PinAddress(instanceId, pinId), key -> counter.incrementAndGet());
        return PREFIX + number;
    }

    public int allocatedCount() {
        return numbers.size();
    }

    /**
     * Snapshot of the table in allocation order.
     */
    public Map<PinAddress, String> getIdentifiers() {
        Map<PinAddress, String> snapshot = new LinkedHashMap<>();
        numbers.entrySet().stream()
                .sorted(Map.Entry.comparingByValue(Comparator.naturalOrder()))
                .forEach(e -> snapshot.put(e.getKey(), PREFIX + e.getValue()));
        return snapshot;
    }
}
