package fisk.domain.fiscal.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for printer URI parsing
 * @since 17/10/2026
 */
class PrinterUriTest {

    @Test
    @DisplayName("Should select the Tremol protocol by scheme")
    void shouldParseZfpUri() {
        // When
        PrinterUri uri = PrinterUri.parse("bg.zk.zfp.com://COM3");

        // Then
        assertThat(uri.protocol()).isEqualTo(EProtocol.TREMOL_ZFP);
        assertThat(uri.port()).isEqualTo("COM3");
        assertThat(uri.baudRate()).isZero();
        assertThat(uri.toString()).isEqualTo("bg.zk.zfp.com://COM3");
    }

    @Test
    @DisplayName("Should read the optional baud rate")
    void shouldParseBaudRate() {
        // When
        PrinterUri uri = PrinterUri.parse("bg.ed.isl.com:///dev/ttyUSB0?baudRate=9600");

        // Then
        assertThat(uri.protocol()).isEqualTo(EProtocol.ELTRADE_ISL);
        assertThat(uri.port()).isEqualTo("/dev/ttyUSB0");
        assertThat(uri.baudRate()).isEqualTo(9600);
        assertThat(uri.toString()).isEqualTo("bg.ed.isl.com:///dev/ttyUSB0?baudRate=9600");
    }

    @Test
    @DisplayName("Should reject unknown schemes and malformed URIs")
    void shouldRejectInvalidUris() {
        assertThatThrownBy(() -> PrinterUri.parse("bg.dt.x.com://COM1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported printer URI scheme");
        assertThatThrownBy(() -> PrinterUri.parse("COM1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no scheme");
        assertThatThrownBy(() -> PrinterUri.parse("bg.zk.zfp.com://"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no port");
        assertThatThrownBy(() -> PrinterUri.parse("bg.zk.zfp.com://COM1?baudRate=fast"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid baud rate");
        assertThatThrownBy(() -> PrinterUri.parse(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
