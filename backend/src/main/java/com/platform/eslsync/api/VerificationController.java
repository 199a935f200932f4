package com.platform.eslsync.api;

import com.platform.eslsync.model.VerificationResult;
import com.platform.eslsync.verification.VerificationScheduler;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Operator API for drift verification.
 */
@RestController
@RequestMapping("/api/verification")
public class VerificationController {
    
    private final VerificationScheduler scheduler;
    
    public VerificationController(VerificationScheduler scheduler) {
        this.scheduler = scheduler;
    }
    
    @PostMapping("/run")
    public List<VerificationResult> runNow() {
        return scheduler.verifyNow();
    }
    
    @GetMapping("/status")
    public VerificationScheduler.SchedulerStats getStatus() {
        return scheduler.getStats();
    }
    
    @PostMapping("/scheduler/start")
    public Map<String, Object> start(@RequestParam long intervalMs) {
        boolean started = scheduler.start(intervalMs);
        return Map.of("started", started, "running", scheduler.isRunning());
    }
    
    @PostMapping("/scheduler/stop")
    public Map<String, Object> stop() {
        boolean stopped = scheduler.stop();
        return Map.of("stopped", stopped, "running", scheduler.isRunning());
    }
}
