package fisk.domain.fiscal.codec;

import fisk.domain.fiscal.EPaymentType;
import fisk.domain.fiscal.EReversalReason;
import fisk.domain.fiscal.ETaxGroup;

import java.util.Map;
import java.util.Optional;

/**
 * Vendor command grammar: packet layout, field delimiter and enum tokens
 * @since 15/10/2026
 */
public interface ICommandCodec {
    byte[] encode(Command command);
    RawResponse decode(byte[] packet) throws ProtocolException;
    char getFieldDelimiter();
    Optional<String> getTaxGroupToken(ETaxGroup taxGroup);
    Optional<String> getReversalReasonToken(EReversalReason reason);
    // Default tokens before any per-device remapping
    Map<EPaymentType, String> getDefaultPaymentTypeTokens();
}
