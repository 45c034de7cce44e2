package com.permit.resolution.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RunTransaction Tests")
class RunTransactionTest {

    @Test
    @DisplayName("Committed steps are not undone")
    void commitKeepsSteps() {
        List<String> log = new ArrayList<>();
        try (RunTransaction tx = new RunTransaction("run-1")) {
            tx.apply("a", () -> log.add("do-a"), () -> log.add("undo-a"));
            tx.commit();
            assertTrue(tx.isCommitted());
        }
        assertEquals(List.of("do-a"), log);
    }

    @Test
    @DisplayName("Failed step undoes itself and earlier steps, newest first")
    void failureUndoesInReverse() {
        List<String> log = new ArrayList<>();
        RunTransaction tx = new RunTransaction("run-1");
        tx.apply("a", () -> log.add("do-a"), () -> log.add("undo-a"));
        tx.apply("b", () -> log.add("do-b"), () -> log.add("undo-b"));

        assertThrows(IllegalStateException.class, () -> tx.apply("c",
                () -> { throw new IllegalStateException("boom"); },
                () -> log.add("undo-c")));

        assertEquals(List.of("do-a", "do-b", "undo-c", "undo-b", "undo-a"), log);
    }

    @Test
    @DisplayName("Closing without commit rolls back")
    void abandonedRollsBack() {
        List<String> log = new ArrayList<>();
        try (RunTransaction tx = new RunTransaction("run-1")) {
            tx.apply("a", () -> log.add("do-a"), () -> log.add("undo-a"));
        }
        assertEquals(List.of("do-a", "undo-a"), log);
    }

    @Test
    @DisplayName("A failing undo does not stop the remaining undos")
    void undoFailureContinues() {
        List<String> log = new ArrayList<>();
        try (RunTransaction tx = new RunTransaction("run-1")) {
            tx.apply("a", () -> log.add("do-a"), () -> log.add("undo-a"));
            tx.apply("b", () -> log.add("do-b"), () -> { throw new IllegalStateException("undo broke"); });
        }
        assertEquals(List.of("do-a", "do-b", "undo-a"), log);
    }

    @Test
    @DisplayName("No steps are accepted after commit")
    void applyAfterCommitRejected() {
        RunTransaction tx = new RunTransaction("run-1");
        tx.commit();
        assertThrows(IllegalStateException.class, () -> tx.apply("late", () -> {}, () -> {}));
    }
}
