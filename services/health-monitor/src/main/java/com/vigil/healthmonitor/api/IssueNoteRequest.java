package com.vigil.healthmonitor.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Body of the resolve and won't-fix transitions.
 *
 * @param note resolution or reason recorded on the issue
 */
public record IssueNoteRequest(@NotBlank @Size(max = 2000) String note) {}
