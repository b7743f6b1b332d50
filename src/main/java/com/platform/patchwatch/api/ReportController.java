package com.platform.patchwatch.api;

import com.platform.patchwatch.report.ReportFilter;
import com.platform.patchwatch.report.ReportService;
import com.platform.patchwatch.report.ReportSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Set;

/**
 * Patch status report, served from the cache.
 */
@RestController
@RequestMapping("/api/report")
@RequiredArgsConstructor
public class ReportController {

    private final ReportService reportService;

    @GetMapping
    public ResponseEntity<ReportSnapshot> getReport(
            @RequestParam(defaultValue = "false") boolean securityOnly,
            @RequestParam(name = "host", required = false) List<String> hosts) {
        ReportFilter filter = new ReportFilter(hosts == null ? Set.of() : Set.copyOf(hosts), securityOnly);
        return ResponseEntity.ok(reportService.snapshot(filter));
    }
}
