package eu.fbk.rdfquads.internal;

import java.util.Map;

import com.google.common.collect.ImmutableMap;

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.LoggingEvent;

public class LoggingTest {

    @After
    public void clearMDC() {
        MDC.clear();
    }

    @Test
    public void testSetContext() {
        Assert.assertNull(Logging.setContext("first.ttl"));
        Assert.assertEquals("first.ttl", Logging.setContext("second.ttl"));
        Assert.assertEquals("second.ttl", MDC.get(Logging.MDC_CONTEXT));
        Assert.assertEquals("second.ttl", Logging.setContext(null));
        Assert.assertNull(MDC.get(Logging.MDC_CONTEXT));
    }

    @Test
    public void testMDCCopy() {
        Logging.setMDC(ImmutableMap.of(Logging.MDC_CONTEXT, "doc.nq", "other", "x"));
        final Map<String, String> copy = Logging.getMDC();
        Assert.assertEquals("doc.nq", copy.get(Logging.MDC_CONTEXT));
        Logging.setMDC(null);
        Assert.assertNull(MDC.get("other"));
    }

    @Test
    public void testContextConverter() {
        final Logging.ContextConverter converter = new Logging.ContextConverter();
        Assert.assertEquals("", converter.convert(event(Level.INFO)));
        Assert.assertEquals("[TurtleParser] ", converter.convert(event(Level.WARN)));

        Logging.setContext("data.ttl");
        Assert.assertEquals("[data.ttl] ", converter.convert(event(Level.DEBUG)));
        Assert.assertEquals("[data.ttl][TurtleParser] ", converter.convert(event(Level.ERROR)));
    }

    private static LoggingEvent event(final Level level) {
        final Logger logger = (Logger) LoggerFactory
                .getLogger("eu.fbk.rdfquads.rio.TurtleParser");
        return new LoggingEvent(Logger.class.getName(), logger, level, "message", null, null);
    }

}
