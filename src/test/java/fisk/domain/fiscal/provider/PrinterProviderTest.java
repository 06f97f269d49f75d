package fisk.domain.fiscal.provider;

import fisk.dal.PrinterOptions;
import fisk.dal.SerialConfig;
import fisk.domain.fiscal.DeviceInfo;
import fisk.domain.fiscal.channel.IChannel;
import fisk.domain.fiscal.driver.IFiscalPrinter;
import fisk.domain.fiscal.driver.IslFiscalPrinter;
import fisk.domain.fiscal.driver.ScriptedChannel;
import fisk.domain.fiscal.driver.ZfpFiscalPrinter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static fisk.domain.fiscal.driver.ScriptedChannel.islAnswer;
import static fisk.domain.fiscal.driver.ScriptedChannel.zfpAnswer;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for connecting printers by URI
 * @since 17/10/2026
 */
class PrinterProviderTest {

    private final ScriptedChannel channel = new ScriptedChannel();
    private final List<PrinterUri> opened = new ArrayList<>();

    private final PrinterProvider provider = new PrinterProvider(new SerialConfig(115200, 1000, 1000)) {
        @Override
        protected IChannel openChannel(PrinterUri uri) {
            opened.add(uri);
            return channel;
        }
    };

    @Test
    @DisplayName("Should connect a Tremol printer and keep its URI")
    void shouldConnectZfpPrinter() throws PrinterConnectException {
        // Given
        channel.answer(zfpAnswer("ZK123456;50163145")).answer(zfpAnswer("1;03;2019-01-01;FP01-KL;1.02"));

        // When
        IFiscalPrinter printer = provider.connect("bg.zk.zfp.com://COM3", PrinterOptions.defaults());

        // Then
        assertThat(printer).isInstanceOf(ZfpFiscalPrinter.class);
        DeviceInfo info = printer.getDeviceInfo();
        assertThat(info.getSerialNumber()).isEqualTo("ZK123456");
        assertThat(info.getUri()).isEqualTo("bg.zk.zfp.com://COM3");
        assertThat(opened).extracting(PrinterUri::port).containsExactly("COM3");
    }

    @Test
    @DisplayName("Should connect an Eltrade printer")
    void shouldConnectIslPrinter() throws PrinterConnectException {
        // Given
        channel.answer(islAnswer("ISL5011 1.00,ABCD,00000000,BG,ED123456,44123456"));

        // When
        IFiscalPrinter printer = provider.connect("bg.ed.isl.com://COM4?baudRate=9600", PrinterOptions.defaults());

        // Then
        assertThat(printer).isInstanceOf(IslFiscalPrinter.class);
        assertThat(printer.getDeviceInfo().getSerialNumber()).isEqualTo("ED123456");
        assertThat(opened.get(0).baudRate()).isEqualTo(9600);
    }

    @Test
    @DisplayName("Should close the channel of a printer that does not identify")
    void shouldRejectSilentPrinter() {
        // Given
        channel.fail("Read timeout");

        // When & Then
        assertThatThrownBy(() -> provider.connect("bg.zk.zfp.com://COM3", PrinterOptions.defaults()))
                .isInstanceOf(PrinterConnectException.class)
                .hasMessageContaining("did not identify");
        assertThat(channel.isClosed()).isTrue();
    }

    @Test
    @DisplayName("Should reject an invalid URI without opening a channel")
    void shouldRejectInvalidUri() {
        assertThatThrownBy(() -> provider.connect("tcp://10.0.0.1", PrinterOptions.defaults()))
                .isInstanceOf(PrinterConnectException.class)
                .hasMessageContaining("Unsupported printer URI scheme");
        assertThat(opened).isEmpty();
    }
}
