package com.bookforge.io;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A delimited table as read from disk: the header and every row keyed by column name.
 * Cells missing from a short row are simply absent from that row's map.
 */
@Value
public class CsvTable {

    List<String> header;
    List<Map<String, String>> rows;
}
