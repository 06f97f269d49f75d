package fisk.domain.jobs;

import fisk.domain.fiscal.DeviceStatus;

/**
 * Snapshot of a job for polling clients. The result is set only for finished jobs.
 * @since 16/10/2026
 */
public record TaskInfoResult(ETaskStatus taskStatus, DeviceStatus result) {

    public static TaskInfoResult unknown() {
        return new TaskInfoResult(ETaskStatus.UNKNOWN, null);
    }
}
