package fisk.domain.fiscal;

import org.joda.time.LocalDateTime;

/**
 * @since 14/10/2026
 */
public record CurrentDateTime(LocalDateTime deviceDateTime) {
}
