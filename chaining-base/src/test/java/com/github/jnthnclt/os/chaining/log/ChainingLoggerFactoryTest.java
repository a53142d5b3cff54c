package com.github.jnthnclt.os.chaining.log;

import com.github.jnthnclt.os.chaining.log.ChainingLoggerFactory.ChainingLoggerProvider;
import com.github.jnthnclt.os.chaining.log.ChainingLoggerFactory.SysoutChainingLogger;
import com.github.jnthnclt.os.chaining.log.ChainingLoggerFactory.SysoutChainingLoggerLevel;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.testng.Assert;
import org.testng.annotations.Test;

public class ChainingLoggerFactoryTest {

    @Test
    public void testGetLogger() throws Exception {
        ChainingLoggerProvider was = ChainingLoggerFactory.LOGGER_PROVIDER.get();
        try {
            ChainingLoggerFactory.loggers.remove(ChainingLoggerFactoryTest.class.getName());
            ChainingLoggerFactory.LOGGER_PROVIDER.set(name -> new SysoutChainingLogger(name, SysoutChainingLoggerLevel.DEBUG));

            ChainingLogger l = ChainingLoggerFactory.getLogger();
            Assert.assertTrue(l.isDebugEnabled());
            Assert.assertSame(ChainingLoggerFactory.getLogger(), l);
            Assert.assertSame(ChainingLoggerFactory.getLogger(ChainingLoggerFactoryTest.class.getName()), l);

            l.debug("Debug");
            l.debug("Debug", new RuntimeException());
            l.debug("Debug {}", "1");
            l.debug("Debug {} {}", "1", "2");
            l.debug("Debug {} {} {}", "1", "2", "3");
            l.debug("Debug {} {} {} {}", "1", "2", "3", "4");

            l.info("Info {}", new int[] { 1, 2, 3 });
            l.warn("Warn {} {}", "1", "2");
            l.error("Error", new RuntimeException());
        } finally {
            ChainingLoggerFactory.LOGGER_PROVIDER.set(was);
            ChainingLoggerFactory.loggers.remove(ChainingLoggerFactoryTest.class.getName());
        }
    }

    @Test
    public void testLevelFiltering() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        SysoutChainingLogger l = new SysoutChainingLogger("filter", SysoutChainingLoggerLevel.WARN, out);

        Assert.assertFalse(l.isDebugEnabled());
        l.debug("hidden {}", 1);
        l.info("hidden");
        l.warn("shown {}", 2);
        l.error("shown {} {}", 3, 4);

        String logged = bytes.toString(StandardCharsets.UTF_8);
        Assert.assertFalse(logged.contains("hidden"));
        Assert.assertTrue(logged.contains("WARN filter shown 2"), logged);
        Assert.assertTrue(logged.contains("ERROR filter shown 3 4"), logged);
    }

    @Test
    public void testTrailingThrowable() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        SysoutChainingLogger l = new SysoutChainingLogger("cause", SysoutChainingLoggerLevel.INFO,
            new PrintStream(bytes, true, StandardCharsets.UTF_8));

        l.warn("failed {}", "x", new IllegalStateException("cause-marker"));

        String logged = bytes.toString(StandardCharsets.UTF_8);
        Assert.assertTrue(logged.contains("WARN cause failed x"), logged);
        Assert.assertTrue(logged.contains("IllegalStateException: cause-marker"), logged);
    }

    @Test
    public void testOff() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        SysoutChainingLogger l = new SysoutChainingLogger("off", SysoutChainingLoggerLevel.OFF,
            new PrintStream(bytes, true, StandardCharsets.UTF_8));
        l.error("nothing");
        Assert.assertEquals(bytes.size(), 0);
    }

    @Test
    public void testFormat() throws Exception {
        Assert.assertEquals(ChainingLoggerFactory.format("a {} b {}", "x", 2), "a x b 2");
        Assert.assertEquals(ChainingLoggerFactory.format("a {} b {}", "x"), "a x b {}");
        Assert.assertEquals(ChainingLoggerFactory.format("a {}", "x", "y"), "a x");
        Assert.assertEquals(ChainingLoggerFactory.format("no anchors"), "no anchors");
        Assert.assertEquals(ChainingLoggerFactory.format("{}", (Object) null), "null");
        Assert.assertEquals(ChainingLoggerFactory.format("{}", (Object) new long[] { 1, 2 }), "[1, 2]");
        Assert.assertEquals(ChainingLoggerFactory.format("{}", (Object) new Object[] { "1", "2" }), "[1, 2]");
    }
}
