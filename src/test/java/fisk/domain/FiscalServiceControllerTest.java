package fisk.domain;

import fisk.dal.PrinterConfig;
import fisk.dal.ServiceOptions;
import fisk.domain.fiscal.DeviceStatus;
import fisk.domain.fiscal.driver.IFiscalPrinter;
import fisk.domain.jobs.EPrintJobAction;
import fisk.domain.jobs.PrintJobQueue;
import fisk.domain.registry.PrinterRegistry;
import io.reactivex.rxjava3.core.Observable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for request routing of the service controller
 * @since 17/10/2026
 */
@ExtendWith(MockitoExtension.class)
class FiscalServiceControllerTest {

    @Mock
    private PrinterRegistry registry;

    @Mock
    private PrintJobQueue jobQueue;

    @Mock
    private IFiscalPrinter printer;

    private ServiceOptions options;
    private FiscalServiceController controller;

    @BeforeEach
    void setUp() {
        options = new ServiceOptions();
        options.ensureServerId();
        controller = new FiscalServiceController(registry, jobQueue, options);
    }

    @Test
    @DisplayName("Should start the job queue and detect printers without forcing auto-detect")
    void shouldStartAndDetect() {
        // Given
        when(jobQueue.getEvents()).thenReturn(Observable.never());
        when(registry.detect(false)).thenReturn(true);

        // When
        controller.start();
        controller.stop();

        // Then
        verify(jobQueue).start();
        verify(registry).detect(false);
        verify(jobQueue).shutdown();
        verify(registry).closeAll();
    }

    @Test
    @DisplayName("Should queue actions only for known printers")
    void shouldRunOnKnownPrinter() {
        // Given
        DeviceStatus status = new DeviceStatus();
        when(registry.get("zk123456")).thenReturn(Optional.of(printer));
        when(registry.get("missing")).thenReturn(Optional.empty());
        when(jobQueue.runAsync(printer, EPrintJobAction.PRINT_X_REPORT, null, -1L)).thenReturn(status);

        // When
        Optional<Object> result = controller.run("zk123456", EPrintJobAction.PRINT_X_REPORT, null, -1L);
        Optional<Object> unknown = controller.run("missing", EPrintJobAction.PRINT_X_REPORT, null, -1L);

        // Then
        assertThat(result).containsSame(status);
        assertThat(unknown).isEmpty();
        verify(jobQueue).runAsync(any(), any(), any(), anyLong());
    }

    @Test
    @DisplayName("Should force auto-detect on explicit detection")
    void shouldForceDetect() {
        // Given
        when(registry.detect(true)).thenReturn(false);

        // When & Then
        assertThat(controller.detect()).isFalse();
    }

    @Test
    @DisplayName("Should expose server identity and configured printers")
    void shouldReportServiceInfo() {
        // Given
        options.putPrinter("front", new PrinterConfig("bg.zk.zfp.com://COM3"));
        when(registry.isReady()).thenReturn(true);

        // When
        FiscalServiceController.ServiceInfo info = controller.getServiceInfo();

        // Then
        assertThat(info.serverId()).isEqualTo(options.getServerId());
        assertThat(info.autoDetect()).isTrue();
        assertThat(info.ready()).isTrue();
        assertThat(info.printers()).containsOnlyKeys("front");
    }
}
