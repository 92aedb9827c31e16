package com.example.pdfconvert.model;

import lombok.Value;

/**
 * One rendered PDF page, PNG encoded. {@code pageIndex} is zero based.
 * The PNG bytes are copied on the way in and on the way out.
 */
@Value
public class PageImage {

    public static final String MIME_TYPE = "image/png";

    int pageIndex;
    int width;
    int height;
    byte[] data;

    public PageImage(int pageIndex, int width, int height, byte[] data) {
        this.pageIndex = pageIndex;
        this.width = width;
        this.height = height;
        this.data = data.clone();
    }

    public byte[] getData() {
        return data.clone();
    }

    public int getPageNumber() {
        return pageIndex + 1;
    }
}
