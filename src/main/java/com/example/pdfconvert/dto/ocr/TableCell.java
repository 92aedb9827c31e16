package com.example.pdfconvert.dto.ocr;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TableCell {
    private String text;
    private BoundingBox boundingBox;
    private int row;
    private int column;
    private int rowSpan = 1;
    private int columnSpan = 1;
}
