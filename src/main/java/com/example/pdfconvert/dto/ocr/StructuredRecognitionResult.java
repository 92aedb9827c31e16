package com.example.pdfconvert.dto.ocr;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Recognition result with block, table and layout detection.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class StructuredRecognitionResult extends RecognitionResult {
    private List<TextBlock> blocks = new ArrayList<>();
    private List<Table> tables = new ArrayList<>();
    private LayoutInfo layout;

    public StructuredRecognitionResult(RecognitionResult basic, List<TextBlock> blocks,
                                       List<Table> tables, LayoutInfo layout) {
        super(basic.getText(), basic.getConfidence(), basic.getLanguage(),
              basic.getEngine(), basic.getProcessingTime());
        this.blocks = blocks;
        this.tables = tables;
        this.layout = layout;
    }
}
