package com.questrail.logic.runtime;

import com.questrail.logic.block.PersistentState;
import com.questrail.logic.block.SBlock;
import com.questrail.logic.kernel.Circuit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Circuit-level handling of the persistent data map: the startup check, pruning
 * of stale entries, and the final save with the stop timestamp.
 */
final class PersistenceCoordinator {

    private static final Logger log = LoggerFactory.getLogger(PersistenceCoordinator.class);

    private final Circuit circuit;

    PersistenceCoordinator(Circuit circuit) {
        this.circuit = circuit;
    }

    private List<SBlock> persistentBlocks() {
        return circuit.blocks(SBlock.class).stream()
                .filter(b -> b instanceof PersistentState && b.isPersistent())
                .toList();
    }

    /**
     * Reads the stop timestamp of the previous run and removes entries that no
     * persistent block claims. Without a data map, persistence is disabled.
     */
    void check() {
        List<SBlock> persistent = persistentBlocks();
        Map<String, Object> store = circuit.persistentData();
        if (store == null) {
            if (!persistent.isEmpty()) {
                log.warn("No data storage, state persistence unavailable");
                persistent.forEach(SBlock::disablePersistence);
            }
            return;
        }

        Object stopTime = store.get(Circuit.STOP_TIME_KEY);
        if (stopTime instanceof Instant ts) {
            circuit.setPersistentTimestamp(ts);
            if (ts.isAfter(circuit.wallClock().now())) {
                log.error("The timestamp of persistent data is in the future, check the system time");
            }
        } else {
            circuit.setPersistentTimestamp(null);
            log.warn("The timestamp of persistent data is missing or invalid, state expiration will not be checked");
        }

        Set<String> used = new HashSet<>();
        persistent.forEach(b -> used.add(b.persistenceKey()));
        for (String key : Set.copyOf(store.keySet())) {
            if (key.startsWith(Circuit.RESERVED_KEY_PREFIX) || used.contains(key)) {
                continue;
            }
            log.info("Removing unused persistent state for '{}'", key);
            store.remove(key);
        }
    }

    /**
     * Saves the state of every persistent block.
     */
    void saveAll() {
        if (circuit.persistentData() == null) {
            return;
        }
        persistentBlocks().forEach(SBlock::savePersistentState);
    }

    /**
     * Saves the state of the given blocks and records the stop time.
     */
    void saveOnStop(Set<SBlock> started) {
        Map<String, Object> store = circuit.persistentData();
        if (store == null) {
            return;
        }
        for (SBlock blk : persistentBlocks()) {
            if (started.contains(blk)) {
                blk.savePersistentState();
            }
        }
        try {
            store.put(Circuit.STOP_TIME_KEY, circuit.wallClock().now());
        } catch (RuntimeException e) {
            log.warn("Cannot save the stop time: {}", e.toString());
        }
    }
}
