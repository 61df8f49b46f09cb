package com.logicloop.evaluation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads a dataset: a JSON array of problems.
 */
@Component
public class ProblemLoader {

    private static final Logger log = LoggerFactory.getLogger(ProblemLoader.class);

    private static final TypeReference<List<Problem>> PROBLEM_LIST = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public ProblemLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<Problem> load(Path dataset) throws IOException {
        try (InputStream in = Files.newInputStream(dataset)) {
            List<Problem> problems = load(in);
            log.info("[Dataset] Loaded {} problem(s) from {}", problems.size(), dataset);
            return problems;
        }
    }

    public List<Problem> load(InputStream in) throws IOException {
        List<Problem> problems = mapper.readValue(in, PROBLEM_LIST);
        return problems != null ? List.copyOf(problems) : List.of();
    }
}
