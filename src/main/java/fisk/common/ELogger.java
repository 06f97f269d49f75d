package fisk.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named loggers routed to their own appenders in log4j2.xml
 * @since 15/10/2026
 */
public enum ELogger {
    APP("App"),
    PROTOCOL("FiscalProt"),
    JOBS("PrintJobs"),
    ;

    private final String name;

    ELogger(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public Logger getLogger() {
        return LoggerFactory.getLogger(name);
    }
}
