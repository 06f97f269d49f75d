package fisk.domain.orchestration;

/**
 * Body of the printer configure and delete requests
 * @since 17/10/2026
 */
public record PrinterConfigRequest(String id, String uri) {
}
