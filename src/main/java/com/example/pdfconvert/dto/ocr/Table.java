package com.example.pdfconvert.dto.ocr;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Table {
    private List<TableRow> rows = new ArrayList<>();
    private BoundingBox boundingBox;
    private double confidence;

    public int getColumnCount() {
        return rows.stream().mapToInt(row -> row.getCells().size()).max().orElse(0);
    }
}
