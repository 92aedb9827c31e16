package com.example.pdfconvert.dto.ocr;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TextBlock {
    private String text;
    private double confidence;
    private BoundingBox boundingBox;
    private BlockType type;

    public enum BlockType {
        PARAGRAPH,
        HEADING,
        TABLE_ROW,
        MATH,
        TITLE,
        LINE,
        WORD
    }
}
