package eu.fbk.rdfquads.internal;

import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.collect.Maps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.color.ANSIConstants;
import ch.qos.logback.core.pattern.color.ForegroundCompositeConverterBase;

/**
 * Logging helpers: MDC manipulation and the pattern converters referenced by
 * {@code logback.xml}.
 * <p>
 * The MDC key {@link #MDC_CONTEXT} holds the name of the document currently processed, if any;
 * {@link ContextConverter} prefixes log lines with it.
 * </p>
 */
public final class Logging {

    private static final Logger LOGGER = LoggerFactory.getLogger(Logging.class);

    public static final String MDC_CONTEXT = "context";

    private Logging() {
    }

    @Nullable
    public static Map<String, String> getMDC() {
        try {
            return MDC.getCopyOfContextMap();
        } catch (final Throwable ex) {
            LOGGER.warn("Could not retrieve MDC map", ex);
            return null;
        }
    }

    public static void setMDC(@Nullable final Map<String, String> mdc) {
        try {
            MDC.setContextMap(mdc == null ? Maps.<String, String>newHashMap() : mdc);
        } catch (final Throwable ex) {
            LOGGER.warn("Could not update MDC map", ex);
        }
    }

    /**
     * Sets the document context of the current thread.
     *
     * @param context
     *            the new context, null to clear it
     * @return the previous context, to be restored by the caller
     */
    @Nullable
    public static String setContext(@Nullable final String context) {
        final String previous = MDC.get(MDC_CONTEXT);
        if (context == null) {
            MDC.remove(MDC_CONTEXT);
        } else {
            MDC.put(MDC_CONTEXT, context);
        }
        return previous;
    }

    public static final class NormalConverter extends
            ForegroundCompositeConverterBase<ILoggingEvent> {

        @Override
        protected String getForegroundColorCode(final ILoggingEvent event) {
            switch (event.getLevel().toInt()) {
            case Level.ERROR_INT:
                return ANSIConstants.RED_FG;
            case Level.WARN_INT:
                return ANSIConstants.MAGENTA_FG;
            default:
                return ANSIConstants.DEFAULT_FG;
            }
        }

    }

    public static final class BoldConverter extends
            ForegroundCompositeConverterBase<ILoggingEvent> {

        @Override
        protected String getForegroundColorCode(final ILoggingEvent event) {
            switch (event.getLevel().toInt()) {
            case Level.ERROR_INT:
                return ANSIConstants.BOLD + ANSIConstants.RED_FG;
            case Level.WARN_INT:
                return ANSIConstants.BOLD + ANSIConstants.MAGENTA_FG;
            default:
                return ANSIConstants.BOLD + ANSIConstants.DEFAULT_FG;
            }
        }

    }

    /**
     * Renders {@code [document] } from the MDC, followed by {@code [logger] } for warnings and
     * errors; renders the empty string if neither applies.
     */
    public static final class ContextConverter extends ClassicConverter {

        @Override
        public String convert(final ILoggingEvent event) {
            final Map<String, String> mdc = event.getMDCPropertyMap();
            final String context = mdc == null ? null : mdc.get(MDC_CONTEXT);
            final String logger = event.getLevel().toInt() >= Level.WARN_INT ? shorten(event
                    .getLoggerName()) : null;
            final StringBuilder builder = new StringBuilder();
            if (context != null) {
                builder.append('[').append(context).append(']');
            }
            if (logger != null) {
                builder.append('[').append(logger).append(']');
            }
            return builder.length() == 0 ? "" : builder.append(' ').toString();
        }

        private static String shorten(final String loggerName) {
            final int index = loggerName.lastIndexOf('.');
            return index < 0 ? loggerName : loggerName.substring(index + 1);
        }

    }

}
