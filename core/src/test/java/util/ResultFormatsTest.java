package util;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResultFormatsTest {

    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    @Test
    void testFixedDigits() {
        assertEquals("0.1235", ResultFormats.fixed4(nodes.numberNode(0.123456)));
        assertEquals("2.00", ResultFormats.fixed(nodes.numberNode(2), 2));
    }

    @Test
    void testSmallPValue() {
        assertEquals("< .001", ResultFormats.pValue(nodes.numberNode(0.0004)));
        assertEquals("0.0420", ResultFormats.pValue(nodes.numberNode(0.042)));
    }

    @Test
    void testMissingValuesAreNotAvailable() {
        assertEquals(ResultFormats.NOT_AVAILABLE, ResultFormats.fixed4(null));
        assertEquals(ResultFormats.NOT_AVAILABLE, ResultFormats.pValue(nodes.nullNode()));
        assertEquals(ResultFormats.NOT_AVAILABLE, ResultFormats.text(null));
        assertEquals(ResultFormats.NOT_AVAILABLE, ResultFormats.yesNo(nodes.textNode("yes")));
    }

    @Test
    void testYesNo() {
        assertEquals("Yes", ResultFormats.yesNo(nodes.booleanNode(true)));
        assertEquals("No", ResultFormats.yesNo(nodes.booleanNode(false)));
    }
}
