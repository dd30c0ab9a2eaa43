package org.stianloader.addonresolve.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class JULLogAdapterTest {

    @Test
    public void testPlaceholders() {
        assertEquals("Repository repoX: 3 add-on(s) loaded", JULLogAdapter.format("Repository {}: {} add-on(s) loaded", "repoX", 3));
        assertEquals("no arguments {}", JULLogAdapter.format("no arguments {}"));
        assertEquals("value: null", JULLogAdapter.format("value: {}", (Object) null));
        assertEquals("a b c", JULLogAdapter.format("a {}", "b", "c"));
    }

    @Test
    public void testTrailingThrowable() {
        String formatted = JULLogAdapter.format("Unable to load {}", "A", new IllegalStateException("broken"));
        assertTrue(formatted.startsWith("Unable to load A" + System.lineSeparator()));
        assertTrue(formatted.contains("java.lang.IllegalStateException: broken"));

        formatted = JULLogAdapter.format("failure", new IllegalStateException("broken"));
        assertTrue(formatted.startsWith("failure" + System.lineSeparator() + "java.lang.IllegalStateException: broken"));
    }

    @Test
    public void testDefaultLogger() {
        LoggingAdapter previous = LoggingAdapter.getDefaultLogger();
        try {
            LoggingAdapter.setDefaultLogger(new JULLogAdapter());
            LoggingAdapter.getDefaultLogger().info(JULLogAdapterTest.class, "Logged through {}", "java.util.logging");
        } finally {
            LoggingAdapter.setDefaultLogger(previous);
        }
        // slf4j-simple is on the test classpath
        assertTrue(previous instanceof SLF4JLogAdapter);
    }
}
