package fisk.domain.jobs;

/**
 * Returned instead of the job result when the caller does not wait for completion
 * @since 16/10/2026
 */
public record TaskIdResult(String taskId) {
}
