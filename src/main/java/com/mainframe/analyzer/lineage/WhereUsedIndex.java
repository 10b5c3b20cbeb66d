package com.mainframe.analyzer.lineage;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reference sites of every field, paragraph, copybook and file, keyed by upper-case name.
 *
 * Keys are sorted; each reference list keeps the order in which the sites were found.
 */
@Value
public class WhereUsedIndex {

    public static final WhereUsedIndex EMPTY = new Accumulator().build();

    Map<String, List<Reference>> dataItems;
    Map<String, List<Reference>> paragraphs;
    Map<String, List<Reference>> copybooks;
    Map<String, List<Reference>> files;

    public List<Reference> dataItemReferences(String name) {
        return dataItems.getOrDefault(name, List.of());
    }

    public List<Reference> paragraphReferences(String name) {
        return paragraphs.getOrDefault(name, List.of());
    }

    public List<Reference> copybookReferences(String name) {
        return copybooks.getOrDefault(name, List.of());
    }

    public List<Reference> fileReferences(String name) {
        return files.getOrDefault(name, List.of());
    }

    /**
     * Concatenates the indexes in the given order.
     */
    public static WhereUsedIndex merge(List<WhereUsedIndex> indexes) {
        Accumulator accumulator = new Accumulator();
        for (WhereUsedIndex index : indexes) {
            accumulator.addAll(index);
        }
        return accumulator.build();
    }

    /**
     * Mutable collector used while walking a program.
     */
    public static class Accumulator {
        private final Map<String, List<Reference>> dataItems = new TreeMap<>();
        private final Map<String, List<Reference>> paragraphs = new TreeMap<>();
        private final Map<String, List<Reference>> copybooks = new TreeMap<>();
        private final Map<String, List<Reference>> files = new TreeMap<>();

        public Accumulator dataItem(String name, Reference reference) {
            dataItems.computeIfAbsent(name, k -> new ArrayList<>()).add(reference);
            return this;
        }

        public Accumulator paragraph(String name, Reference reference) {
            paragraphs.computeIfAbsent(name, k -> new ArrayList<>()).add(reference);
            return this;
        }

        public Accumulator copybook(String name, Reference reference) {
            copybooks.computeIfAbsent(name, k -> new ArrayList<>()).add(reference);
            return this;
        }

        public Accumulator file(String name, Reference reference) {
            files.computeIfAbsent(name, k -> new ArrayList<>()).add(reference);
            return this;
        }

        Accumulator addAll(WhereUsedIndex index) {
            index.getDataItems().forEach((k, v) -> dataItems.computeIfAbsent(k, x -> new ArrayList<>()).addAll(v));
            index.getParagraphs().forEach((k, v) -> paragraphs.computeIfAbsent(k, x -> new ArrayList<>()).addAll(v));
            index.getCopybooks().forEach((k, v) -> copybooks.computeIfAbsent(k, x -> new ArrayList<>()).addAll(v));
            index.getFiles().forEach((k, v) -> files.computeIfAbsent(k, x -> new ArrayList<>()).addAll(v));
            return this;
        }

        public WhereUsedIndex build() {
            return new WhereUsedIndex(freeze(dataItems), freeze(paragraphs), freeze(copybooks), freeze(files));
        }

        private static Map<String, List<Reference>> freeze(Map<String, List<Reference>> source) {
            Map<String, List<Reference>> copy = new TreeMap<>();
            source.forEach((k, v) -> copy.put(k, List.copyOf(v)));
            return Collections.unmodifiableMap(copy);
        }
    }
}
