package com.ijp.lifecycle.posting.api;

import com.ijp.lifecycle.posting.model.SweepSummary;
import com.ijp.lifecycle.posting.model.SweeperStatusResponse;
import com.ijp.lifecycle.posting.service.ExpirySweeper;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/sweeper")
public class SweeperController {
    private final ExpirySweeper sweeper;

    public SweeperController(ExpirySweeper sweeper) {
        this.sweeper = sweeper;
    }

    @PostMapping("/run")
    public SweepSummary run() {
        return sweeper.run();
    }

    @PostMapping("/cancel")
    public SweeperStatusResponse cancel() {
        sweeper.cancel();
        return sweeper.getStatus();
    }

    @GetMapping("/status")
    public SweeperStatusResponse status() {
        return sweeper.getStatus();
    }
}
