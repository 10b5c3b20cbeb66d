package com.mainframe.analyzer.lineage;

import com.mainframe.analyzer.model.StatementKind;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * File to create / read / update / delete program lists.
 *
 * WRITE counts as create, READ and START as read, REWRITE as update and DELETE as delete.
 * OPEN and CLOSE do not appear in the matrix.
 */
@Value
public class CrudMatrix {

    public static final CrudMatrix EMPTY = new CrudMatrix(Map.of());

    Map<String, Entry> files;

    public Entry entry(String fileName) {
        return files.getOrDefault(fileName, Entry.NONE);
    }

    @Value
    public static class Entry {
        static final Entry NONE = new Entry(List.of(), List.of(), List.of(), List.of());

        List<String> create;
        List<String> read;
        List<String> update;
        List<String> delete;
    }

    public static CrudMatrix of(List<FileOperation> operations) {
        Map<String, Row> rows = new TreeMap<>();
        for (FileOperation op : operations) {
            Set<String> cell = rows.computeIfAbsent(op.getFileName(), k -> new Row()).cell(op.getOperation());
            if (cell != null) {
                cell.add(op.getLocation().getProgram());
            }
        }
        Map<String, Entry> entries = new TreeMap<>();
        rows.forEach((file, row) -> entries.put(file, row.toEntry()));
        return new CrudMatrix(Collections.unmodifiableMap(entries));
    }

    private static class Row {
        final Set<String> create = new LinkedHashSet<>();
        final Set<String> read = new LinkedHashSet<>();
        final Set<String> update = new LinkedHashSet<>();
        final Set<String> delete = new LinkedHashSet<>();

        Set<String> cell(StatementKind kind) {
            return switch (kind) {
                case WRITE -> create;
                case READ, START -> read;
                case REWRITE -> update;
                case DELETE -> delete;
                default -> null;
            };
        }

        Entry toEntry() {
            return new Entry(List.copyOf(create), List.copyOf(read), List.copyOf(update), List.copyOf(delete));
        }
    }
}
