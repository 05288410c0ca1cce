package cli;

import model.Dataset;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvDatasetReaderTest {

    private Dataset read(String csv) throws IOException {
        return new CsvDatasetReader().read("test.csv", new BufferedReader(new StringReader(csv)));
    }

    @Test
    void testNumbersAndTextAreDetected() throws IOException {
        Dataset dataset = read("date,sales,region\n2024-01-01,10.5,North\n2024-01-02,12,South\n");

        assertEquals(List.of("date", "sales", "region"), dataset.getColumns());
        assertEquals(2, dataset.rowCount());
        assertEquals(List.of("sales"), dataset.getNumericColumns());
        assertEquals(12.0, dataset.getRows().get(1).get("sales"));
    }

    @Test
    void testByteOrderMarkIsStripped() throws IOException {
        Dataset dataset = read("\uFEFFvalue\n1\n2\n");

        assertEquals(List.of("value"), dataset.getColumns());
    }

    @Test
    void testEmptyCellsAreMissingValues() throws IOException {
        Dataset dataset = read("x,y\n1,\n2,3\n\n");

        assertEquals(2, dataset.rowCount());
        assertNull(dataset.getRows().get(0).get("y"));
        assertEquals(List.of("x", "y"), dataset.getNumericColumns());
    }

    @Test
    void testQuotedCells() {
        assertEquals(List.of("a,b", "say \"hi\"", ""), CsvDatasetReader.splitLine("\"a,b\",\"say \"\"hi\"\"\","));
    }

    @Test
    void testTooManyValuesIsRejected() {
        IOException e = assertThrows(IOException.class, () -> read("x\n1,2\n"));
        assertTrue(e.getMessage().contains("Line 2"));
    }

    @Test
    void testEmptyFileIsRejected() {
        assertThrows(IOException.class, () -> read(""));
    }
}
