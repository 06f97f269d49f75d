package fisk.domain.orchestration;

import com.google.gson.JsonParseException;
import fisk.domain.FiscalServiceController;
import fisk.domain.fiscal.Credentials;
import fisk.domain.fiscal.CurrentDateTime;
import fisk.domain.fiscal.DeviceInfo;
import fisk.domain.fiscal.FiscalReport;
import fisk.domain.fiscal.Receipt;
import fisk.domain.fiscal.ReversalReceipt;
import fisk.domain.fiscal.TransferAmount;
import fisk.domain.jobs.EPrintJobAction;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

import static io.javalin.apibuilder.ApiBuilder.get;
import static io.javalin.apibuilder.ApiBuilder.path;
import static io.javalin.apibuilder.ApiBuilder.post;

/**
 * REST controller for printers and service management.
 * <p>Printer actions run through the job queue. {@code ?asyncTimeout=} sets
 * how long the request waits for the job: 0 returns the task id at once,
 * no value waits the default timeout.</p>
 * @since 17/10/2026
 */
public class PrinterApiController {
    private static final Logger logger = LoggerFactory.getLogger(PrinterApiController.class);
    static final String ASYNC_TIMEOUT_PARAM = "asyncTimeout";

    private final FiscalServiceController controller;

    public PrinterApiController(FiscalServiceController controller) {
        this.controller = controller;
    }

    /**
     * Register all REST API routes
     */
    public void registerRoutes() {
        path("/printers", () -> {
            get(ctx -> ctx.json(controller.getPrinters()));
            get("/taskinfo", this::getTaskInfo);
            path("/{id}", () -> {
                get(this::getPrinter);
                get("/status", ctx -> run(ctx, EPrintJobAction.CHECK_STATUS, null));
                post("/receipt", ctx -> runWithBody(ctx, EPrintJobAction.PRINT_RECEIPT, Receipt.class));
                post("/reversalreceipt",
                        ctx -> runWithBody(ctx, EPrintJobAction.PRINT_REVERSAL_RECEIPT, ReversalReceipt.class));
                post("/deposit", ctx -> runWithBody(ctx, EPrintJobAction.PRINT_MONEY_DEPOSIT, TransferAmount.class));
                post("/withdraw", ctx -> runWithBody(ctx, EPrintJobAction.PRINT_MONEY_WITHDRAW, TransferAmount.class));
                post("/datetime", ctx -> runWithBody(ctx, EPrintJobAction.SET_DATE_TIME, CurrentDateTime.class));
                post("/fiscalreport", ctx -> runWithBody(ctx, EPrintJobAction.PRINT_FISCAL_REPORT, FiscalReport.class));
                post("/xreport", ctx -> run(ctx, EPrintJobAction.PRINT_X_REPORT, credentials(ctx)));
                post("/zreport", ctx -> run(ctx, EPrintJobAction.PRINT_Z_REPORT, credentials(ctx)));
                post("/duplicate", ctx -> run(ctx, EPrintJobAction.PRINT_DUPLICATE, credentials(ctx)));
                post("/reset", ctx -> run(ctx, EPrintJobAction.RESET, credentials(ctx)));
            });
        });

        path("/service", () -> {
            get("/config", ctx -> ctx.json(ApiResponse.success(controller.getServiceInfo())));
            post("/detect", this::detect);
            post("/printers/configure", this::configurePrinter);
            post("/printers/delete", this::deletePrinter);
        });
    }

    private void getPrinter(Context ctx) {
        Optional<DeviceInfo> info = controller.getPrinterInfo(ctx.pathParam("id"));
        if (info.isPresent()) {
            ctx.json(info.get());
        } else {
            printerNotFound(ctx);
        }
    }

    private void getTaskInfo(Context ctx) {
        ctx.json(controller.getTaskInfo(ctx.queryParam("id")));
    }

    private <T> void runWithBody(Context ctx, EPrintJobAction action, Class<T> documentType) {
        T document;
        try {
            document = ctx.body().isBlank() ? null : ctx.bodyAsClass(documentType);
        } catch (JsonParseException e) {
            logger.warn("Invalid {} body: {}", action, e.getMessage());
            ctx.status(400).json(ApiResponse.error("Invalid request body: " + e.getMessage()));
            return;
        }
        if (document == null) {
            ctx.status(400).json(ApiResponse.error(documentType.getSimpleName() + " is required"));
            return;
        }
        run(ctx, action, document);
    }

    private void run(Context ctx, EPrintJobAction action, Object document) {
        long asyncTimeout = ctx.queryParamAsClass(ASYNC_TIMEOUT_PARAM, Long.class).getOrDefault(-1L);
        Optional<Object> result = controller.run(ctx.pathParam("id"), action, document, asyncTimeout);
        if (result.isPresent()) {
            ctx.json(result.get());
        } else {
            printerNotFound(ctx);
        }
    }

    private Credentials credentials(Context ctx) {
        if (ctx.body().isBlank()) {
            return Credentials.empty();
        }
        Credentials credentials = ctx.bodyAsClass(Credentials.class);
        return credentials == null ? Credentials.empty() : credentials;
    }

    private void detect(Context ctx) {
        if (controller.detect()) {
            ctx.json(ApiResponse.success("Printers detected", controller.getPrinters()));
        } else {
            ctx.status(409).json(ApiResponse.error("Detection is not possible while print jobs are pending"));
        }
    }

    private void configurePrinter(Context ctx) {
        PrinterConfigRequest request = ctx.bodyAsClass(PrinterConfigRequest.class);
        if (request != null && controller.configurePrinter(request.id(), request.uri())) {
            ctx.json(ApiResponse.success("Printer configured", request));
        } else {
            ctx.status(400).json(ApiResponse.error("Printer id and uri are required"));
        }
    }

    private void deletePrinter(Context ctx) {
        PrinterConfigRequest request = ctx.bodyAsClass(PrinterConfigRequest.class);
        if (request != null && controller.deletePrinter(request.id())) {
            ctx.json(ApiResponse.success("Printer deleted", request.id()));
        } else {
            ctx.status(404).json(ApiResponse.error("Printer is not configured"));
        }
    }

    private void printerNotFound(Context ctx) {
        ctx.status(404).json(ApiResponse.error("Printer " + ctx.pathParam("id") + " not found"));
    }
}
