package org.camunda.bpm.getstarted.bpmnlayout;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Debug tracing for the pipeline stages. Messages reach the logger only when tracing was
 * switched on through {@link LayoutConfig#debug()}.
 */
public final class LayoutTrace {
    private final Logger logger;
    private final boolean enabled;

    public LayoutTrace(Logger logger, boolean enabled) {
        this.logger = logger;
        this.enabled = enabled;
    }

    public static LayoutTrace disabled() {
        return new LayoutTrace(LoggerFactory.getLogger(LayoutTrace.class), false);
    }

    public boolean enabled() {
        return enabled && logger.isDebugEnabled();
    }

    public void trace(String format, Object... args) {
        if (enabled) {
            logger.debug(format, args);
        }
    }

    public void stage(String name) {
        if (enabled) {
            logger.debug("[{}] start", name);
        }
    }

    public void warn(String format, Object... args) {
        logger.warn(format, args);
    }
}
