package com.scrapehub.jobs.api;

import com.scrapehub.jobs.model.ActiveTrigger;
import com.scrapehub.jobs.model.ReconciliationResult;
import com.scrapehub.jobs.model.SchedulerStatusResponse;
import com.scrapehub.jobs.service.ReconciliationService;
import com.scrapehub.jobs.service.TriggerScheduler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/scheduler")
public class SchedulerController {
    private final ReconciliationService reconciliationService;
    private final TriggerScheduler triggerScheduler;

    public SchedulerController(ReconciliationService reconciliationService, TriggerScheduler triggerScheduler) {
        this.reconciliationService = reconciliationService;
        this.triggerScheduler = triggerScheduler;
    }

    @GetMapping("/triggers")
    public List<ActiveTrigger> activeTriggers() {
        return triggerScheduler.listActiveTriggers();
    }

    @GetMapping("/status")
    public SchedulerStatusResponse status() {
        return reconciliationService.getStatus();
    }

    @PostMapping("/reconcile")
    public ReconciliationResult reconcile() {
        return reconciliationService.reconcileNow("manual");
    }
}
