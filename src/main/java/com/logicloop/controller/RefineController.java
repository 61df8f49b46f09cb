package com.logicloop.controller;

import com.logicloop.core.solver.SolverAdapter;
import com.logicloop.core.solver.SolverBackend;
import com.logicloop.core.solver.SolverResult;
import com.logicloop.orchestrator.RefinementController;
import com.logicloop.orchestrator.dto.RefinementTrace;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/refine")
public class RefineController {

    private final RefinementController refinementController;
    private final SolverAdapter        solverAdapter;

    public RefineController(RefinementController refinementController, SolverAdapter solverAdapter) {
        this.refinementController = refinementController;
        this.solverAdapter        = solverAdapter;
    }

    @PostMapping("/run")
    public ResponseEntity<RefinementTrace> run(
            @RequestBody Map<String, String> request
    ) {

        String statement = request.get("statement");

        if (statement == null || statement.trim().isEmpty()) {
            return ResponseEntity.badRequest().build();
        }

        RefinementTrace trace = refinementController.run(request.get("id"), statement);

        return ResponseEntity.ok(trace);
    }

    /** Direct solver call; the adapter turns every failure into an Error result. */
    @PostMapping("/solve")
    public ResponseEntity<SolverResult> solve(
            @RequestBody SolveRequest request
    ) {

        SolverBackend backend;
        try {
            backend = request.getBackend() == null
                    ? refinementController.getConfig().getBackend()
                    : SolverBackend.fromName(request.getBackend());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }

        SolverResult result = solverAdapter.solve(
                request.getPremises() != null ? request.getPremises() : List.of(),
                request.getConclusion(),
                backend,
                refinementController.getConfig().getSolverTimeout());

        return ResponseEntity.ok(result);
    }

    public static class SolveRequest {

        private List<String> premises;
        private String       conclusion;
        private String       backend;

        public List<String> getPremises()   { return premises; }
        public String       getConclusion() { return conclusion; }
        public String       getBackend()    { return backend; }

        public void setPremises(List<String> premises)  { this.premises = premises; }
        public void setConclusion(String conclusion)    { this.conclusion = conclusion; }
        public void setBackend(String backend)          { this.backend = backend; }
    }
}
