package fisk.domain.fiscal.status;

import fisk.common.IslConstants;

import java.util.List;

import static fisk.domain.fiscal.status.StatusBit.RESERVED;
import static fisk.domain.fiscal.status.StatusBit.error;
import static fisk.domain.fiscal.status.StatusBit.info;
import static fisk.domain.fiscal.status.StatusBit.warning;

/**
 * Eltrade ISL status bits, 6 bytes, listed from bit 0 to bit 7 of each byte.
 * Byte 3 carries the switch states and is decoded separately.
 * @since 15/10/2026
 */
public final class IslStatusBits {
    private IslStatusBits() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public static final List<StatusBit> TABLE = List.of(
            // Byte 0
            error("E401", "Incoming data has syntax error"),
            error("E402", "Code of incoming command is invalid"),
            error("E103", "The clock needs setting"),
            info("Not connected a customer display"),
            error("E303", "Failure in printing mechanism"),
            error("E199", "General error"),
            RESERVED,
            RESERVED,

            // Byte 1
            error("E403", "During command some of the fields for the sums overflow"),
            error("E404", "Command cannot be performed in the current fiscal mode"),
            error("E104", "Operational memory was cleared"),
            error("E102", "Low battery (the clock is in reset state)"),
            error("E105", "RAM failure after switch ON"),
            error("E302", "Paper cover is open"),
            error("E599", "The internal terminal is not working"),
            RESERVED,

            // Byte 2
            error("E301", "No paper"),
            warning("W301", "Not enough paper"),
            error("E206", "End of KLEN (under 1MB free)"),
            info("A fiscal receipt is opened"),
            warning("W202", "Coming end of KLEN (10MB free)"),
            info("A non-fiscal receipt is opened"),
            RESERVED,
            RESERVED,

            // Byte 3, switches SW1 to SW7
            RESERVED,
            RESERVED,
            RESERVED,
            RESERVED,
            RESERVED,
            RESERVED,
            RESERVED,
            RESERVED,

            // Byte 4
            error("E202", "Error during writing to the fiscal memory"),
            info("EIK is entered"),
            info("FM number has been set"),
            warning("W201", "There is space for not more than 50 entries in the FM"),
            error("E201", "Fiscal memory is fully engaged"),
            error("E299", "FM general error"),
            RESERVED,
            RESERVED,

            // Byte 5
            error("E204", "The fiscal memory is in the 'read-only' mode"),
            info("The fiscal memory is formatted"),
            error("E202", "The last record in the fiscal memory is not successful"),
            info("The printer is in a fiscal mode"),
            info("Tax rates have been entered at least once"),
            error("E203", "Fiscal memory read error"),
            RESERVED,
            RESERVED
    );

    public static StatusDecoder decoder() {
        return new StatusDecoder(TABLE, IslConstants.SWITCH_STATE_BYTE);
    }
}
