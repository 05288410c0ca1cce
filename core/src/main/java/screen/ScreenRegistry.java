package screen;

import java.util.*;
import java.util.logging.Logger;

/**
 * Реестр экранов анализа, доступных мастеру.
 */
public final class ScreenRegistry {
    private static final Logger logger = Logger.getLogger(ScreenRegistry.class.getName());

    private final Map<String, AnalysisScreen<?>> screens = new LinkedHashMap<>();

    /**
     * Реестр со всеми встроенными экранами.
     */
    public static ScreenRegistry withDefaults() {
        ScreenRegistry registry = new ScreenRegistry();
        registry.register(new AcfPacfScreen());
        registry.register(new LjungBoxScreen());
        registry.register(new AutocorrelationScreen());
        registry.register(new LinearityScreen());
        registry.register(new RelativeImportanceScreen());
        registry.register(new InstrumentalVariableScreen());
        return registry;
    }

    public synchronized void register(AnalysisScreen<?> screen) {
        Objects.requireNonNull(screen, "screen cannot be null");
        if (screens.containsKey(screen.getSlug())) {
            logger.warning("Screen " + screen.getSlug() + " already registered, replacing");
        }
        screens.put(screen.getSlug(), screen);
        logger.fine("Registered screen: " + screen.getSlug());
    }

    public synchronized Optional<AnalysisScreen<?>> getScreen(String slug) {
        return Optional.ofNullable(screens.get(slug));
    }

    public synchronized List<AnalysisScreen<?>> getAllScreens() {
        return new ArrayList<>(screens.values());
    }

    public synchronized Set<String> getSlugs() {
        return new LinkedHashSet<>(screens.keySet());
    }
}
