package fisk.domain.fiscal.status;

import java.util.List;

import static fisk.domain.fiscal.status.StatusBit.RESERVED;
import static fisk.domain.fiscal.status.StatusBit.error;
import static fisk.domain.fiscal.status.StatusBit.info;
import static fisk.domain.fiscal.status.StatusBit.warning;

/**
 * Tremol ZFP status bits, 7 bytes, listed from bit 0 to bit 7 of each byte
 * @since 15/10/2026
 */
public final class ZfpStatusBits {
    private ZfpStatusBits() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public static final List<StatusBit> TABLE = List.of(
            // Byte 0
            error("E204", "FM read only"),
            info("Power down in opened fiscal receipt"),
            error("E303", "Printer not ready - overheat"),
            error("E103", "Date and time not set"),
            error("E103", "Date and time wrong"),
            error("E104", "RAM reset"),
            error("E102", "Hardware clock error"),
            RESERVED,

            // Byte 1
            error("E301", "No paper"),
            error("E403", "Reports registers overflow"),
            info("Customer report is not zeroed"),
            info("Daily report is not zeroed"),
            info("Article report is not zeroed"),
            info("Operator report is not zeroed"),
            info("Duplicate printed"),
            RESERVED,

            // Byte 2
            info("Opened non-fiscal receipt"),
            info("Opened fiscal receipt"),
            info("Opened fiscal detailed receipt"),
            info("Opened fiscal receipt with VAT"),
            info("Opened invoice fiscal receipt"),
            warning("W202", "SD card near full"),
            error("E206", "SD card full"),
            RESERVED,

            // Byte 3
            error("E299", "No FM module"),
            error("E299", "FM error"),
            error("E201", "FM full"),
            warning("W201", "FM near full"),
            info("Decimal point"),
            info("FM fiscalized"),
            info("FM produced"),
            RESERVED,

            // Byte 4
            info("Printer: automatic cutting"),
            info("External display: transparent display"),
            info("Speed is 9600"),
            RESERVED,
            info("Drawer: automatic opening"),
            info("Customer logo included in the receipt"),
            RESERVED,
            RESERVED,

            // Byte 5
            error("E501", "Wrong SIM card"),
            error("E502", "Blocking 3 days without mobile operator"),
            warning("W503", "No task from NRA"),
            RESERVED,
            RESERVED,
            error("E207", "Wrong SD card"),
            error("E599", "Deregistered"),
            RESERVED,

            // Byte 6
            warning("W504", "No SIM card"),
            warning("W505", "No GPRS modem"),
            warning("W506", "No mobile operator"),
            warning("W507", "No GPRS service"),
            warning("W301", "Near end of paper"),
            warning("W508", "Unsent data for 24 hours"),
            RESERVED,
            RESERVED
    );

    public static StatusDecoder decoder() {
        return new StatusDecoder(TABLE);
    }
}
