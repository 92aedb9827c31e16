package com.example.pdfconvert.dto.ocr;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LayoutInfo {
    private int pageWidth;
    private int pageHeight;
    private Orientation orientation;
    private int columnCount;
    private boolean hasTables;
    private boolean hasDiagrams;

    public enum Orientation {
        PORTRAIT,
        LANDSCAPE
    }
}
