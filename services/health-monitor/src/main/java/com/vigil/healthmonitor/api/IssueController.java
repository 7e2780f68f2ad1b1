package com.vigil.healthmonitor.api;

import com.vigil.monitoring.issue.AgentIssue;
import com.vigil.monitoring.issue.AgentIssueTracker;
import com.vigil.monitoring.issue.IssueFilter;
import com.vigil.monitoring.issue.IssueSeverity;
import com.vigil.monitoring.issue.IssueStats;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Issue listing and lifecycle. Illegal transitions surface as 409, unknown ids as 404.
 */
@RestController
@RequestMapping("/api/v1/issues")
public class IssueController {

    private final AgentIssueTracker tracker;

    public IssueController(AgentIssueTracker tracker) {
        this.tracker = tracker;
    }

    /** Open issues, most severe first. Every parameter is optional. */
    @GetMapping
    public List<AgentIssue> openIssues(
            @RequestParam(required = false) String agent,
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String destination) {
        IssueSeverity parsedSeverity = severity != null && !severity.isBlank() ? parseSeverity(severity) : null;
        return tracker.getOpenIssues(new IssueFilter(agent, parsedSeverity, category, destination));
    }

    @GetMapping("/sla-breaches")
    public List<AgentIssue> slaBreaches() {
        return tracker.getSLABreaches();
    }

    @GetMapping("/stats")
    public IssueStats stats() {
        return tracker.getStats();
    }

    @GetMapping("/{issueId}")
    public AgentIssue issue(@PathVariable String issueId) {
        return tracker.getIssue(issueId);
    }

    @PostMapping("/{issueId}/acknowledge")
    public AgentIssue acknowledge(@PathVariable String issueId) {
        return tracker.acknowledge(issueId);
    }

    @PostMapping("/{issueId}/start")
    public AgentIssue start(@PathVariable String issueId) {
        return tracker.startProgress(issueId);
    }

    @PostMapping("/{issueId}/resolve")
    public AgentIssue resolve(@PathVariable String issueId, @Valid @RequestBody IssueNoteRequest request) {
        return tracker.resolve(issueId, request.note());
    }

    @PostMapping("/{issueId}/wont-fix")
    public AgentIssue wontFix(@PathVariable String issueId, @Valid @RequestBody IssueNoteRequest request) {
        return tracker.markWontFix(issueId, request.note());
    }

    private static IssueSeverity parseSeverity(String severity) {
        try {
            return IssueSeverity.fromKey(severity);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: " + severity, e);
        }
    }
}
