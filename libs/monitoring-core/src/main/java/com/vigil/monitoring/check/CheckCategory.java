package com.vigil.monitoring.check;

import java.util.Locale;

/**
 * Domain a probe belongs to. The first five categories make up a full health report; backups and
 * disk are evaluated by the backup health run.
 */
public enum CheckCategory {
    SERVER,
    STORAGE,
    EXTERNAL,
    FRONTENDS,
    QUEUES,
    BACKUPS,
    DISK;

    /** Lower-case key used in alert keys, fingerprints and JSON. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
