package com.stablemint.engine;

import com.stablemint.ledger.UndoJournal;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * State of one running public operation: its undo journal and the events it will emit on commit.
 */
public class OperationContext {

    @Getter
    private final UndoJournal journal = new UndoJournal();
    private final List<Object> pendingEvents = new ArrayList<>();

    public void emit(Object event) {
        pendingEvents.add(event);
    }

    public List<Object> pendingEvents() {
        return Collections.unmodifiableList(pendingEvents);
    }

    void rollback(Throwable cause) {
        journal.rollback(cause);
        pendingEvents.clear();
    }
}
