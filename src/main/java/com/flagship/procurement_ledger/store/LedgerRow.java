package com.flagship.procurement_ledger.store;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One physical row of the ledger table.
 *
 * Position 1 is the header row; data rows start at position 2. Missing cells
 * (short rows) read as the empty string, the same way an empty spreadsheet cell does.
 */
@Value
public class LedgerRow {

    public static final int HEADER_POSITION = 1;

    int position;
    List<String> cells;

    public LedgerRow(int position, List<String> cells) {
        if (position < HEADER_POSITION) {
            throw new IllegalArgumentException("Row positions are 1-indexed, got " + position);
        }
        this.position = position;
        List<String> copy = new ArrayList<>(cells.size());
        for (String cell : cells) {
            copy.add(cell == null ? "" : cell);
        }
        this.cells = Collections.unmodifiableList(copy);
    }

    public String cell(LedgerColumn column) {
        int index = column.index();
        return index < cells.size() ? cells.get(index) : "";
    }

    public boolean isHeader() {
        return position == HEADER_POSITION;
    }

    /**
     * Cell values for the header row, in column order.
     */
    public static List<String> headerCells() {
        List<String> header = new ArrayList<>(LedgerColumn.count());
        for (LedgerColumn column : LedgerColumn.values()) {
            header.add(column.headerTitle());
        }
        return header;
    }
}
