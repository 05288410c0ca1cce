package report;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType0Font;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import screen.ExportLayout;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Раскладка области результатов на страницы PDF и растеризация в одно PNG-изображение.
 *
 * <p>Страница содержит заголовок, разделы макета (пары "метка - значение", таблицы)
 * и встроенные графики. Графики должны быть встроенными изображениями в base64;
 * ссылка на удаленный ресурс не может быть растеризована и считается ошибкой.
 *
 * <p>Экземпляр не потокобезопасен: состояние страницы хранится в полях на время одного вызова.
 */
public final class ResultsPageRenderer {
    private static final Logger logger = Logger.getLogger(ResultsPageRenderer.class.getName());

    private static final float MARGIN = 50;
    private static final float PAGE_WIDTH = PDRectangle.A4.getWidth();
    private static final float PAGE_HEIGHT = PDRectangle.A4.getHeight();
    private static final float CONTENT_WIDTH = PAGE_WIDTH - 2 * MARGIN;
    private static final float LINE_HEIGHT = 14;
    private static final String DATA_URL_PREFIX = "base64,";

    /** Масштаб растеризации относительно 72 dpi. */
    public static final float SCALE = 2f;

    private PDDocument document;
    private PDPageContentStream currentContent;
    private float yPosition;
    private PDFont regularFont;
    private PDFont boldFont;

    /**
     * Растеризовать макет в PNG на белом фоне в масштабе {@link #SCALE}.
     *
     * @throws RenderException если график не может быть декодирован или встроен
     */
    public byte[] renderPng(ExportLayout layout) throws RenderException {
        List<BufferedImage> pages = new ArrayList<>();
        document = new PDDocument();
        currentContent = null;
        try {
            loadFonts();
            layout(layout);
            closeCurrentContent();

            PDFRenderer renderer = new PDFRenderer(document);
            for (int i = 0; i < document.getNumberOfPages(); i++) {
                pages.add(renderer.renderImage(i, SCALE, ImageType.RGB));
            }
            return encodePng(stitch(pages));
        } catch (IOException e) {
            throw new RenderException("Failed to render results: " + e.getMessage(), e);
        } finally {
            try {
                closeCurrentContent();
                document.close();
            } catch (IOException e) {
                logger.warning("Failed to close render document: " + e.getMessage());
            }
            document = null;
        }
    }

    private void layout(ExportLayout layout) throws IOException, RenderException {
        addNewPage();

        currentContent.setFont(boldFont, 18);
        drawText(layout.getTitle(), MARGIN, yPosition);
        yPosition -= 32;

        for (ExportLayout.Section section : layout.getSections()) {
            if (section.heading() != null) {
                checkPageSpace(40);
                currentContent.setFont(boldFont, 13);
                drawText(section.heading(), MARGIN, yPosition);
                yPosition -= LINE_HEIGHT + 6;
            }
            currentContent.setFont(regularFont, 11);
            for (ExportLayout.Row row : section.rows()) {
                checkPageSpace(LINE_HEIGHT);
                drawText(row.label(), MARGIN, yPosition);
                drawText(row.value(), MARGIN + CONTENT_WIDTH / 2, yPosition);
                yPosition -= LINE_HEIGHT;
            }
            if (section.table() != null) {
                drawTable(section.table());
            }
            yPosition -= 10;
        }

        for (Map.Entry<String, String> plot : layout.getPlots().entrySet()) {
            drawPlot(plot.getKey(), plot.getValue());
        }
    }

    private void drawTable(ExportLayout.Table table) throws IOException {
        int columns = Math.max(1, table.headers().size());
        float columnWidth = CONTENT_WIDTH / columns;

        checkPageSpace(LINE_HEIGHT * 2);
        currentContent.setFont(boldFont, 10);
        drawRow(table.headers(), columnWidth);
        currentContent.setFont(regularFont, 10);
        for (List<String> row : table.rows()) {
            checkPageSpace(LINE_HEIGHT);
            drawRow(row, columnWidth);
        }
    }

    private void drawRow(List<String> cells, float columnWidth) throws IOException {
        for (int i = 0; i < cells.size(); i++) {
            drawText(cells.get(i), MARGIN + i * columnWidth, yPosition);
        }
        yPosition -= LINE_HEIGHT;
    }

    private void drawPlot(String name, String plot) throws IOException, RenderException {
        BufferedImage image = decodePlot(name, plot);
        PDImageXObject xObject = LosslessFactory.createFromImage(document, image);

        float width = Math.min(CONTENT_WIDTH, image.getWidth());
        float height = width * image.getHeight() / image.getWidth();
        float maxHeight = PAGE_HEIGHT - 2 * MARGIN - 30;
        if (height > maxHeight) {
            width = width * maxHeight / height;
            height = maxHeight;
        }

        checkPageSpace(height + 30);
        currentContent.setFont(boldFont, 12);
        drawText(name, MARGIN, yPosition);
        yPosition -= 10;
        currentContent.drawImage(xObject, MARGIN, yPosition - height, width, height);
        yPosition -= height + 20;
    }

    /**
     * Декодировать встроенный график: base64 PNG/JPEG, с префиксом data URL или без него.
     */
    static BufferedImage decodePlot(String name, String plot) throws RenderException {
        String trimmed = plot.trim();
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            throw new RenderException("Plot '" + name + "' references a remote resource and cannot be rendered");
        }
        int dataIndex = trimmed.indexOf(DATA_URL_PREFIX);
        String encoded = trimmed.startsWith("data:") && dataIndex >= 0
            ? trimmed.substring(dataIndex + DATA_URL_PREFIX.length())
            : trimmed;
        try {
            byte[] bytes = Base64.getMimeDecoder().decode(encoded);
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
            if (image == null) {
                throw new RenderException("Plot '" + name + "' is not a supported image");
            }
            return image;
        } catch (IllegalArgumentException | IOException e) {
            throw new RenderException("Plot '" + name + "' could not be decoded: " + e.getMessage(), e);
        }
    }

    private void loadFonts() {
        // DejaVu supports Cyrillic column names; fall back to Helvetica when it is not bundled.
        try (InputStream fontStream = getClass().getResourceAsStream("/fonts/DejaVuSans.ttf");
             InputStream boldStream = getClass().getResourceAsStream("/fonts/DejaVuSans-Bold.ttf")) {
            if (fontStream != null && boldStream != null) {
                regularFont = PDType0Font.load(document, fontStream, true);
                boldFont = PDType0Font.load(document, boldStream, true);
                return;
            }
        } catch (IOException e) {
            logger.fine("Unicode fonts unavailable, using standard fonts: " + e.getMessage());
        }
        regularFont = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
        boldFont = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
    }

    private void addNewPage() throws IOException {
        closeCurrentContent();
        PDPage page = new PDPage(PDRectangle.A4);
        document.addPage(page);
        currentContent = new PDPageContentStream(document, page);
        yPosition = PAGE_HEIGHT - MARGIN - 20;
        if (regularFont != null) {
            currentContent.setFont(regularFont, 11);
        }
    }

    private void checkPageSpace(float neededSpace) throws IOException {
        if (yPosition < MARGIN + neededSpace) {
            addNewPage();
        }
    }

    private void closeCurrentContent() throws IOException {
        if (currentContent != null) {
            currentContent.close();
            currentContent = null;
        }
    }

    private void drawText(String text, float x, float y) throws IOException {
        String safe = sanitize(text);
        currentContent.beginText();
        try {
            currentContent.newLineAtOffset(x, y);
            currentContent.showText(safe);
        } finally {
            currentContent.endText();
        }
    }

    /**
     * Standard 14 fonts only cover WinAnsi; unencodable characters become '?'.
     */
    private String sanitize(String text) {
        if (text == null) {
            return "";
        }
        String flat = text.replace('\r', ' ').replace('\n', ' ').replace('\t', ' ');
        PDFont font = regularFont;
        StringBuilder safe = new StringBuilder(flat.length());
        flat.codePoints().forEach(codePoint -> {
            String character = new String(Character.toChars(codePoint));
            try {
                font.encode(character);
                safe.append(character);
            } catch (IOException | IllegalArgumentException e) {
                safe.append('?');
            }
        });
        return safe.toString();
    }

    private static BufferedImage stitch(List<BufferedImage> pages) {
        int width = pages.stream().mapToInt(BufferedImage::getWidth).max().orElse(1);
        int height = pages.stream().mapToInt(BufferedImage::getHeight).sum();
        BufferedImage result = new BufferedImage(width, Math.max(1, height), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = result.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, result.getWidth(), result.getHeight());
            int y = 0;
            for (BufferedImage page : pages) {
                graphics.drawImage(page, 0, y, null);
                y += page.getHeight();
            }
        } finally {
            graphics.dispose();
        }
        return result;
    }

    private static byte[] encodePng(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }
}
