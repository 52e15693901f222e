package com.pipewright.core.workspace;

import com.pipewright.core.model.PortPair;

import java.util.Set;

/**
 * Fixed mapping from slot index to a backend/frontend port pair.
 * Slot {@code i} owns backend {@code backendStart + i} and frontend {@code frontendStart + i}.
 */
public class PortPool {

    private final int backendStart;
    private final int frontendStart;
    private final int size;

    public PortPool(int backendStart, int frontendStart, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Port pool size must be positive");
        }
        if (backendStart < frontendStart ? backendStart + size > frontendStart : frontendStart + size > backendStart) {
            throw new IllegalArgumentException("Backend and frontend port ranges overlap");
        }
        this.backendStart = backendStart;
        this.frontendStart = frontendStart;
        this.size = size;
    }

    public static PortPool from(WorkspaceProperties properties) {
        return new PortPool(properties.getBackendPortStart(), properties.getFrontendPortStart(),
                properties.getPoolSize());
    }

    public PortPair portsFor(int slot) {
        if (slot < 0 || slot >= size) {
            throw new IllegalArgumentException("Slot " + slot + " outside pool of " + size);
        }
        return new PortPair(backendStart + slot, frontendStart + slot);
    }

    /**
     * @return the lowest slot not in {@code used}, or -1 when the pool is exhausted
     */
    public int firstFreeSlot(Set<Integer> used) {
        for (int slot = 0; slot < size; slot++) {
            if (!used.contains(slot)) {
                return slot;
            }
        }
        return -1;
    }

    public int size() {
        return size;
    }
}
