package com.vigil.healthmonitor.infrastructure.queue;

/**
 * Redis key layout of a BullMQ queue: {@code <prefix>:<queue>:<state>}.
 */
record BullQueueKeys(String prefix, String queue) {

    String waiting() {
        return key("wait");
    }

    String active() {
        return key("active");
    }

    String completed() {
        return key("completed");
    }

    String failed() {
        return key("failed");
    }

    String delayed() {
        return key("delayed");
    }

    String repeatable() {
        return key("repeat");
    }

    private String key(String state) {
        return prefix + ":" + queue + ":" + state;
    }
}
