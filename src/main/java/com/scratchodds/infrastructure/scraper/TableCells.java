package com.scratchodds.infrastructure.scraper;

import org.jsoup.nodes.Element;

import java.util.List;

/**
 * Direct cell children of a table row. Cells of nested tables are not included.
 */
final class TableCells {

    private TableCells() {
    }

    static List<Element> dataCells(Element row) {
        return row.children().stream()
            .filter(cell -> cell.normalName().equals("td"))
            .toList();
    }

    static List<Element> headerOrDataCells(Element row) {
        return row.children().stream()
            .filter(cell -> cell.normalName().equals("td") || cell.normalName().equals("th"))
            .toList();
    }
}
