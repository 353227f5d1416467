package com.certmanager.service;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JobProgressTest {

    @Test
    void testPercentNeverGoesBackwards() {
        List<Double> seen = new ArrayList<>();
        JobProgress progress = new JobProgress("test", (percent, message) -> seen.add(percent));

        progress.update(40, "halfway");
        progress.update(20, "late report");
        progress.update(250);

        assertEquals(100.0, progress.getPercent());
        assertEquals("late report", progress.getMessage());
        assertEquals(40.0, seen.get(1));
    }

    @Test
    void testFailingListenerDoesNotAbortTheJob() {
        JobProgress progress = new JobProgress("test", (percent, message) -> {
            throw new IllegalStateException("listener down");
        });

        progress.update(50, "still running");

        assertEquals(50.0, progress.getPercent());
    }
}
