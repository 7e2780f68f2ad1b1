package com.vigil.monitoring.issue;

/**
 * Thrown when an issue id does not exist.
 */
public class IssueNotFoundException extends RuntimeException {

    public IssueNotFoundException(String issueId) {
        super("Issue not found: " + issueId);
    }
}
