package com.example.pdfconvert.dto.ocr;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pixel rectangle, origin at the top left of the page.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BoundingBox {
    private int x;
    private int y;
    private int width;
    private int height;

    public int getRight() {
        return x + width;
    }

    public int getBottom() {
        return y + height;
    }

    public boolean fitsWithin(int pageWidth, int pageHeight) {
        return x >= 0 && y >= 0 && x < pageWidth && y < pageHeight
                && getRight() <= pageWidth && getBottom() <= pageHeight;
    }
}
