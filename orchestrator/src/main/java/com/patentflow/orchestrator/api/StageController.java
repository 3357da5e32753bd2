package com.patentflow.orchestrator.api;

import com.patentflow.orchestrator.api.dto.StageResponse;
import com.patentflow.orchestrator.stage.StageRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /stages: the configured pipeline stages.
 */
@RestController
public class StageController {

    private final StageRegistry stages;

    public StageController(StageRegistry stages) {
        this.stages = stages;
    }

    @GetMapping("/stages")
    public List<StageResponse> list() {
        return stages.all().stream()
                .map(StageResponse::from)
                .toList();
    }
}
