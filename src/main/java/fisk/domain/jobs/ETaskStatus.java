package fisk.domain.jobs;

/**
 * @since 16/10/2026
 */
public enum ETaskStatus {
    UNKNOWN,
    ENQUEUED,
    RUNNING,
    FINISHED
}
