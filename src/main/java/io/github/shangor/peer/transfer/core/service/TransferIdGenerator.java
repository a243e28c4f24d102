package io.github.shangor.peer.transfer.core.service;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Hands out transfer ids that are not in use by this endpoint. Ids combine the clock with a
 * random suffix so that two peers are unlikely to pick the same one.
 */
final class TransferIdGenerator {
    private final Set<String> inUse = ConcurrentHashMap.newKeySet();
    private final Predicate<String> taken;
    private final Supplier<String> candidates;

    TransferIdGenerator() {
        this(id -> false, TransferIdGenerator::randomId);
    }

    /**
     * @param taken      ids held elsewhere, such as transfers offered by peers
     * @param candidates source of fresh ids
     */
    TransferIdGenerator(Predicate<String> taken, Supplier<String> candidates) {
        this.taken = taken;
        this.candidates = candidates;
    }

    static String randomId() {
        return Long.toString(System.currentTimeMillis(), 36) + "-"
                + Integer.toHexString(ThreadLocalRandom.current().nextInt(0x1000000));
    }

    String nextId() {
        while (true) {
            String candidate = candidates.get();
            if (!taken.test(candidate) && inUse.add(candidate)) {
                return candidate;
            }
        }
    }

    void release(String id) {
        inUse.remove(id);
    }

    boolean isInUse(String id) {
        return inUse.contains(id);
    }
}
