package com.stablemint.ledger;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Compensating actions recorded while an operation runs. {@link #rollback} replays them newest first.
 */
@Slf4j
public class UndoJournal {

    private static class Entry {
        final String label;
        final Runnable undo;

        Entry(String label, Runnable undo) {
            this.label = label;
            this.undo = undo;
        }
    }

    private final Deque<Entry> entries = new ArrayDeque<>();

    public void record(String label, Runnable undo) {
        entries.push(new Entry(label, undo));
    }

    public int size() {
        return entries.size();
    }

    /**
     * Undo everything recorded so far. A compensation that itself fails is attached to {@code cause}
     * as suppressed and the remaining compensations still run.
     */
    public void rollback(Throwable cause) {
        while (!entries.isEmpty()) {
            Entry e = entries.pop();
            try {
                e.undo.run();
            } catch (RuntimeException ex) {
                log.error("[rollback] compensation '{}' failed: {}", e.label, ex.toString());
                cause.addSuppressed(ex);
            }
        }
    }
}
