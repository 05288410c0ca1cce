package model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DatasetTest {

    @Test
    void testNumericColumnsIgnoreMissingValues() {
        Map<String, Object> withGap = new HashMap<>();
        withGap.put("x", null);
        withGap.put("label", "b");
        Dataset dataset = new Dataset("d", List.of("x", "label"),
            List.of(Map.of("x", 1.0, "label", "a"), withGap, Map.of("x", 3, "label", "c")));

        assertEquals(List.of("x"), dataset.getNumericColumns());
        assertEquals(List.of(1.0, 3.0), dataset.numericValues("x"));
    }

    @Test
    void testColumnWithoutValuesIsNotNumeric() {
        Map<String, Object> row = new HashMap<>();
        row.put("empty", null);
        Dataset dataset = new Dataset("d", List.of("empty"), List.of(row));

        assertTrue(dataset.getNumericColumns().isEmpty());
    }

    @Test
    void testEqualityByContent() {
        assertEquals(TestDatasets.series(10), TestDatasets.series(10));
        assertNotEquals(TestDatasets.series(10), TestDatasets.series(11));
        assertTrue(Dataset.empty().isEmpty());
    }
}
