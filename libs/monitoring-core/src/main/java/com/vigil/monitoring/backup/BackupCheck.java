package com.vigil.monitoring.backup;

import com.vigil.observability.HealthStatus;

/**
 * Recency verdict for one backup type.
 *
 * @param type       backup type
 * @param status     HEALTHY, WARNING or CRITICAL
 * @param latestFile newest matching file name, null when none was found
 * @param ageHours   age of that file in hours (one decimal), null when none was found
 * @param sizeMb     size of that file in MB (three decimals), null when none was found
 * @param message    explanation for non-healthy results or cloud-managed notes
 */
public record BackupCheck(String type, HealthStatus status, String latestFile, Double ageHours, Double sizeMb,
                          String message) {
}
