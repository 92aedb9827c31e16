package com.example.pdfconvert.service.ocr;

import com.example.pdfconvert.dto.ocr.BoundingBox;
import com.example.pdfconvert.dto.ocr.LayoutInfo;
import com.example.pdfconvert.dto.ocr.RecognitionResult;
import com.example.pdfconvert.dto.ocr.StructuredRecognitionResult;
import com.example.pdfconvert.dto.ocr.Table;
import com.example.pdfconvert.dto.ocr.TableCell;
import com.example.pdfconvert.dto.ocr.TableRow;
import com.example.pdfconvert.dto.ocr.TextBlock;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Derives blocks, tables and an approximate layout from recognized markdown.
 * Markdown carries no coordinates, so blocks are stacked top to bottom with fixed metrics
 * and the page is grown until every block fits inside it.
 */
class MarkdownLayoutParser {

    static final int DEFAULT_PAGE_WIDTH = 800;
    static final int DEFAULT_PAGE_HEIGHT = 1000;

    private static final int LINE_HEIGHT = 20;
    private static final int LINE_PITCH = 25;
    private static final int BLANK_LINE_GAP = 20;
    private static final int CHAR_WIDTH = 8;

    private static final Pattern TABLE_SEPARATOR = Pattern.compile("^\\|[\\s:|-]+\\|$");

    private final double confidence;

    MarkdownLayoutParser(double confidence) {
        this.confidence = confidence;
    }

    StructuredRecognitionResult parse(RecognitionResult basic) {
        String markdown = basic.getText() == null ? "" : basic.getText();
        List<TextBlock> blocks = new ArrayList<>();
        List<Table> tables = new ArrayList<>();
        Table currentTable = null;

        int y = 0;
        for (String rawLine : markdown.split("\n")) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                y += BLANK_LINE_GAP;
                currentTable = null;
                continue;
            }

            TextBlock.BlockType type = classify(line);
            BoundingBox box = new BoundingBox(0, y, line.length() * CHAR_WIDTH, LINE_HEIGHT);
            blocks.add(new TextBlock(line, confidence, box, type));

            if (type == TextBlock.BlockType.TABLE_ROW) {
                if (currentTable == null) {
                    currentTable = new Table(new ArrayList<>(), new BoundingBox(0, y, 0, 0), confidence);
                    tables.add(currentTable);
                }
                if (!TABLE_SEPARATOR.matcher(line).matches()) {
                    addRow(currentTable, line, box);
                }
                extend(currentTable.getBoundingBox(), box);
            } else {
                currentTable = null;
            }

            y += LINE_PITCH;
        }
        tables.removeIf(table -> table.getRows().isEmpty());

        int pageWidth = DEFAULT_PAGE_WIDTH;
        int pageHeight = DEFAULT_PAGE_HEIGHT;
        for (TextBlock block : blocks) {
            pageWidth = Math.max(pageWidth, block.getBoundingBox().getRight());
            pageHeight = Math.max(pageHeight, block.getBoundingBox().getBottom());
        }

        LayoutInfo layout = new LayoutInfo(pageWidth, pageHeight,
                pageWidth > pageHeight ? LayoutInfo.Orientation.LANDSCAPE : LayoutInfo.Orientation.PORTRAIT,
                1,
                markdown.contains("|"),
                markdown.contains("$$"));

        return new StructuredRecognitionResult(basic, blocks, tables, layout);
    }

    static TextBlock.BlockType classify(String line) {
        if (line.startsWith("#")) {
            return TextBlock.BlockType.HEADING;
        }
        if (line.length() > 1 && line.startsWith("|") && line.endsWith("|")) {
            return TextBlock.BlockType.TABLE_ROW;
        }
        if (line.startsWith("$$") || line.endsWith("$$")) {
            return TextBlock.BlockType.MATH;
        }
        return TextBlock.BlockType.PARAGRAPH;
    }

    private static void addRow(Table table, String line, BoundingBox rowBox) {
        String[] texts = line.substring(1, line.length() - 1).split("\\|", -1);
        int rowIndex = table.getRows().size();
        int cellWidth = Math.max(1, rowBox.getWidth() / texts.length);

        List<TableCell> cells = new ArrayList<>();
        for (int column = 0; column < texts.length; column++) {
            BoundingBox cellBox = new BoundingBox(rowBox.getX() + column * cellWidth, rowBox.getY(),
                    cellWidth, rowBox.getHeight());
            cells.add(new TableCell(texts[column].trim(), cellBox, rowIndex, column, 1, 1));
        }
        table.getRows().add(new TableRow(cells));
    }

    private static void extend(BoundingBox target, BoundingBox box) {
        int right = Math.max(target.getRight(), box.getRight());
        int bottom = Math.max(target.getBottom(), box.getBottom());
        target.setWidth(right - target.getX());
        target.setHeight(bottom - target.getY());
    }
}
