package cir.lang;

import java.util.BitSet;

import lombok.Getter;

/**
 * Fixed set of scratch variable names for generated loop counters. A slot is
 * held from {@link #acquire} until its {@link Temporary} is closed.
 */
final class TemporaryPool {

    /** An allocated slot; closing it returns the name to the pool. */
    final class Temporary implements AutoCloseable {

        @Getter
        private final String name;
        private final int slot;
        private boolean released = false;

        private Temporary(int slot) {
            this.slot = slot;
            this.name = prefix + slot;
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                release(slot);
            }
        }
    }

    private final String prefix;
    private final int capacity;
    private final BitSet allocated;

    TemporaryPool(int capacity, String prefix) {
        this.capacity = capacity;
        this.prefix = prefix;
        this.allocated = new BitSet(capacity);
    }

    /**
     * Allocates the lowest free slot.
     */
    Temporary acquire(Token at) {
        var slot = allocated.nextClearBit(0);
        if (slot >= capacity) {
            throw new CompileException(CompileException.Phase.SEMANTIC, at,
                "Ran out of temporaries: all " + capacity + " loop counters are in use");
        }
        allocated.set(slot);
        return new Temporary(slot);
    }

    void release(int slot) {
        if (!allocated.get(slot)) {
            throw new CompileException(CompileException.Phase.INTERNAL, "Temporary " + prefix + slot + " is not allocated");
        }
        allocated.clear(slot);
    }

    int inUse() {
        return allocated.cardinality();
    }
}
