package com.logicloop.evaluation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BatchRunnerTest {

    @Test
    void testWorkerCountMustBePositive() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new BatchRunner(null, new Evaluator(), null, 0));
        assertTrue(e.getMessage().contains("workers"));
    }
}
