package com.logicloop.evaluation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.List;

/**
 * Batch mode: when logicloop.evaluation.dataset is set, the dataset is run
 * through the refinement loop at startup and the report is logged.
 */
@Component
@ConditionalOnProperty(name = "logicloop.evaluation.dataset")
public class DatasetRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DatasetRunner.class);

    private final ProblemLoader loader;
    private final BatchRunner   batchRunner;
    private final String        dataset;

    public DatasetRunner(
            ProblemLoader loader,
            BatchRunner   batchRunner,
            @Value("${logicloop.evaluation.dataset}") String dataset
    ) {
        this.loader      = loader;
        this.batchRunner = batchRunner;
        this.dataset     = dataset;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        List<Problem> problems = loader.load(Paths.get(dataset));
        if (problems.isEmpty()) {
            log.warn("[Dataset] {} contains no problems", dataset);
            return;
        }
        EvaluationReport report = batchRunner.runAndEvaluate(problems);
        log.info("[Dataset] Finished {}: {}", dataset, report);
    }
}
