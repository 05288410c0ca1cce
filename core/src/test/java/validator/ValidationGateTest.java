package validator;

import model.Dataset;
import model.TestDatasets;
import org.junit.jupiter.api.Test;
import screen.LagConfig;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValidationGateTest {

    private final ValidationGate<LagConfig> gate = ValidationGate.<LagConfig>builder()
        .bound("maxLags", (config, data) -> data.rowCount() - 1)
        .check("Variable selected",
            ctx -> ctx.config().valueCol() != null,
            ctx -> String.valueOf(ctx.config().valueCol()))
        .check("Lags within bound",
            ctx -> ctx.config().lags() <= ctx.bound("maxLags"),
            ctx -> ctx.config().lags() + " of " + ctx.bound("maxLags"))
        .build();

    @Test
    void testChecksAreEvaluatedInOrder() {
        ValidationReport report = gate.evaluate(new LagConfig("sales", 5), TestDatasets.series(20));

        assertEquals(2, report.checks().size());
        assertEquals("Variable selected", report.checks().get(0).label());
        assertEquals("Lags within bound", report.checks().get(1).label());
        assertEquals("5 of 19", report.checks().get(1).detail());
        assertTrue(report.allPassed());
        assertEquals(2, report.passedCount());
    }

    @Test
    void testFailedChecksAreReported() {
        ValidationReport report = gate.evaluate(new LagConfig(null, 50), TestDatasets.series(20));

        assertFalse(report.allPassed());
        assertEquals(2, report.failedChecks().size());
        assertFalse(gate.allPassed(new LagConfig(null, 50), TestDatasets.series(20)));
    }

    @Test
    void testDerivedBoundsFollowDataset() {
        Map<String, Integer> small = gate.derivedBounds(new LagConfig("sales", 5), TestDatasets.series(20));
        Map<String, Integer> large = gate.derivedBounds(new LagConfig("sales", 5), TestDatasets.series(200));

        assertEquals(19, small.get("maxLags"));
        assertEquals(199, large.get("maxLags"));
    }

    @Test
    void testGateIsPureFunctionOfInputs() {
        LagConfig config = new LagConfig("sales", 10);
        Dataset dataset = TestDatasets.series(30);

        assertEquals(gate.evaluate(config, dataset), gate.evaluate(config, dataset));
        assertEquals(2, gate.ruleCount());
    }

    @Test
    void testUnknownBoundIsRejected() {
        ValidationGate<LagConfig> broken = ValidationGate.<LagConfig>builder()
            .check("Uses missing bound", ctx -> ctx.bound("missing") > 0, ctx -> "")
            .build();

        assertThrows(IllegalArgumentException.class,
            () -> broken.evaluate(new LagConfig("sales", 1), TestDatasets.series(5)));
    }
}
