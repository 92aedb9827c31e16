package com.example.pdfconvert.dto;

import com.example.pdfconvert.model.PageImage;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Base64;

/**
 * A page image prepared for transport: standard padded base64 on a single line.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImageContent {
    private int pageIndex;
    private String mimeType;
    private String data;

    public static ImageContent from(PageImage image) {
        // the basic encoder never inserts line separators
        String encoded = Base64.getEncoder().encodeToString(image.getData());
        return new ImageContent(image.getPageIndex(), PageImage.MIME_TYPE, encoded);
    }
}
