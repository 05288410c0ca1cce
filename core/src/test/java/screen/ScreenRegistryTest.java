package screen;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScreenRegistryTest {

    @Test
    void testDefaultScreensAreRegistered() {
        ScreenRegistry registry = ScreenRegistry.withDefaults();

        assertEquals(Set.of("acf-pacf", "ljung-box", "autocorrelation", "linearity",
            "relative-importance", "instrumental-variable"), registry.getSlugs());
        assertEquals(6, registry.getAllScreens().size());
    }

    @Test
    void testLookupBySlug() {
        ScreenRegistry registry = ScreenRegistry.withDefaults();

        assertTrue(registry.getScreen(LjungBoxScreen.SLUG).isPresent());
        assertInstanceOf(LjungBoxScreen.class, registry.getScreen(LjungBoxScreen.SLUG).get());
        assertTrue(registry.getScreen("unknown").isEmpty());
    }
}
