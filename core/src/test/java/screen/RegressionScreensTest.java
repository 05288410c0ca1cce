package screen;

import com.fasterxml.jackson.databind.JsonNode;
import model.Dataset;
import model.TestDatasets;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RegressionScreensTest {

    @Test
    void testRelativeImportanceDefaultsToLastColumnAsTarget() {
        RelativeImportanceScreen screen = new RelativeImportanceScreen();
        Dataset dataset = TestDatasets.numeric(50, "x1", "x2", "y");

        RegressionConfig config = screen.defaultConfig(dataset);

        assertEquals("y", config.dependent());
        assertEquals(List.of("x1", "x2"), config.independents());
        assertTrue(screen.getGate().allPassed(config, dataset));
    }

    @Test
    void testRelativeImportanceRenamesRequestFields() {
        RelativeImportanceScreen screen = new RelativeImportanceScreen();
        Dataset dataset = TestDatasets.numeric(50, "x1", "x2", "y");

        JsonNode request = screen.buildRequest(new RegressionConfig("y", List.of("x1", "x2")), dataset);

        assertEquals("y", request.get("dependent_var").asText());
        assertEquals(2, request.get("independent_vars").size());
        assertEquals(50, request.get("data").size());
        assertNull(request.get("dependent"));
    }

    @Test
    void testRelativeImportanceNeedsTwoPredictors() {
        RelativeImportanceScreen screen = new RelativeImportanceScreen();
        Dataset dataset = TestDatasets.numeric(50, "x1", "x2", "y");

        assertFalse(screen.getGate().allPassed(new RegressionConfig("y", List.of("x1")), dataset));
        assertFalse(screen.canRun(TestDatasets.numeric(50, "x1", "y")));
    }

    @Test
    void testLinearityStartsWithoutSelection() {
        LinearityScreen screen = new LinearityScreen();
        RegressionConfig config = screen.defaultConfig(TestDatasets.numeric(40, "a", "b"));

        assertNull(config.dependent());
        assertTrue(config.independents().isEmpty());
        assertFalse(screen.getGate().allPassed(config, TestDatasets.numeric(40, "a", "b")));
    }

    @Test
    void testAutocorrelationDefaultsToFirstTwoColumns() {
        AutocorrelationScreen screen = new AutocorrelationScreen();

        RegressionConfig config = screen.defaultConfig(TestDatasets.numeric(40, "a", "b", "c"));

        assertEquals("a", config.dependent());
        assertEquals(List.of("b"), config.independents());
    }

    @Test
    void testInstrumentalVariableGuessesRolesByName() {
        InstrumentalVariableScreen screen = new InstrumentalVariableScreen();
        Dataset dataset = TestDatasets.numeric(40, "wage", "educ", "distance", "exper");

        InstrumentalConfig config = screen.defaultConfig(dataset);

        assertEquals("wage", config.outcome());
        assertEquals("educ", config.endogenous());
        assertEquals(List.of("distance"), config.instruments());
        assertTrue(screen.canRun(dataset));
        assertTrue(screen.getGate().allPassed(config, dataset));
    }

    @Test
    void testInstrumentalVariableSendsNullWithoutControls() {
        InstrumentalVariableScreen screen = new InstrumentalVariableScreen();
        Dataset dataset = TestDatasets.numeric(40, "wage", "educ", "distance");

        JsonNode request = screen.buildRequest(new InstrumentalConfig("wage", "educ", List.of("distance"), List.of()), dataset);

        assertEquals("wage", request.get("outcome_col").asText());
        assertTrue(request.get("exogenous_cols").isNull());
        assertEquals(1, request.get("instrument_cols").size());
    }

    @Test
    void testInstrumentalVariableNeedsThirtyRows() {
        assertFalse(new InstrumentalVariableScreen().canRun(TestDatasets.numeric(29, "wage", "educ", "distance")));
    }

    @Test
    void testLjungBoxMaxLagsIsSampleSizeMinusOne() {
        LjungBoxScreen screen = new LjungBoxScreen();
        Dataset dataset = TestDatasets.series(40);

        LagConfig config = screen.defaultConfig(dataset);

        assertEquals("sales", config.valueCol());
        assertEquals(10, config.lags());
        assertEquals(39, screen.getGate().derivedBounds(config, dataset).get("maxLags"));
        assertFalse(screen.getGate().allPassed(config.withLags(40), dataset));
    }
}
