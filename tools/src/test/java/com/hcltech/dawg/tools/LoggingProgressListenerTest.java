package com.hcltech.dawg.tools;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LoggingProgressListenerTest {

    @Test
    void logsOncePerBucketEntered() {
        List<String> lines = new ArrayList<>();
        LoggingProgressListener listener = new LoggingProgressListener(0.25, lines::add);

        for (double f : new double[]{0.1, 0.2, 0.3, 0.5, 0.55, 0.74, 1.0}) listener.onProgress(f);

        assertEquals(List.of("Minimizing: 30%", "Minimizing: 50%", "Minimizing: 100%"), lines);
    }

    @Test
    void finalOne_isLoggedEvenWithTenthSteps() {
        List<String> lines = new ArrayList<>();
        LoggingProgressListener listener = new LoggingProgressListener(0.1, lines::add);
        listener.onProgress(0.95);
        listener.onProgress(1.0);
        listener.onProgress(1.0);
        assertEquals(List.of("Minimizing: 95%", "Minimizing: 100%"), lines);
    }

    @Test
    void step_mustBeAFraction() {
        assertThrows(IllegalArgumentException.class, () -> new LoggingProgressListener(0));
        assertThrows(IllegalArgumentException.class, () -> new LoggingProgressListener(2));
    }
}
