package util;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Форматирование значений результата для экспортов (CSV, страница результатов).
 *
 * <p>Все методы принимают узлы JSON как есть: отсутствующее или нечисловое значение
 * превращается в {@code N/A}, а не в исключение.
 *
 * @since 1.0
 */
public final class ResultFormats {

    public static final String NOT_AVAILABLE = "N/A";

    private ResultFormats() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Число с фиксированным количеством знаков после запятой.
     *
     * <pre>
     * fixed(0.123456, 4) → "0.1235"
     * fixed(missing, 4)  → "N/A"
     * </pre>
     */
    public static String fixed(JsonNode node, int digits) {
        if (node == null || !node.isNumber()) {
            return NOT_AVAILABLE;
        }
        return String.format(Locale.ROOT, "%." + digits + "f", node.asDouble());
    }

    public static String fixed4(JsonNode node) {
        return fixed(node, 4);
    }

    /**
     * p-value: значения меньше 0.001 выводятся как {@code "< .001"}.
     */
    public static String pValue(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return NOT_AVAILABLE;
        }
        double value = node.asDouble();
        return value < 0.001 ? "< .001" : String.format(Locale.ROOT, "%.4f", value);
    }

    public static String yesNo(JsonNode node) {
        if (node == null || !node.isBoolean()) {
            return NOT_AVAILABLE;
        }
        return node.asBoolean() ? "Yes" : "No";
    }

    /**
     * Текстовое значение узла; числа выводятся без изменения, отсутствующие значения как N/A.
     */
    public static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return NOT_AVAILABLE;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    /**
     * Количество элементов массива (0, если узел не массив).
     */
    public static int size(JsonNode node) {
        return node != null && node.isArray() ? node.size() : 0;
    }

    public static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(item -> values.add(item.asText()));
        }
        return values;
    }
}
