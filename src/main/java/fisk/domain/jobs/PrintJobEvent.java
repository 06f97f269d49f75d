package fisk.domain.jobs;

/**
 * Job state change published by {@link PrintJobQueue}
 * @since 16/10/2026
 */
public record PrintJobEvent(String taskId, EPrintJobAction action, ETaskStatus status, long timestamp) {

    @Override
    public String toString() {
        return String.format("PrintJobEvent{task=%s, action=%s, status=%s}", taskId, action, status);
    }
}
