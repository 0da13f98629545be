package com.work.chainexec.crosschain.web;

import com.work.chainexec.crosschain.domain.ExecutionStep;
import com.work.chainexec.crosschain.service.ChainHopOrchestrator;
import com.work.chainexec.crosschain.service.OrchestratorStats;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 跨链编排只读接口。路径由上游策略通过 {@link ChainHopOrchestrator} 直接提交。
 */
@RestController
@RequestMapping("/api/v1/crosschain")
public class CrossChainController {

    private final ChainHopOrchestrator orchestrator;

    public CrossChainController(ChainHopOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/active")
    public Map<String, List<ExecutionStep>> active() {
        return orchestrator.getActiveExecutions();
    }

    @GetMapping("/stats")
    public OrchestratorStats stats() {
        return orchestrator.getStats();
    }
}
