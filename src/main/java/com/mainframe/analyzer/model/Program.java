package com.mainframe.analyzer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Structural model of one analyzed source file.
 *
 * Every collection is unmodifiable once built. Data items are an arena: item {@code i} sits at
 * {@code dataItems.get(i)} and refers to its relatives by index.
 */
@Value
@Builder(toBuilder = true)
public class Program {

    @NonNull
    String programId;

    @NonNull
    String fileName;

    @NonNull
    @Builder.Default
    ProgramKind kind = ProgramKind.PROGRAM;

    @Singular("division")
    List<Division> divisions;

    @Singular("section")
    List<Section> sections;

    @Singular("paragraph")
    List<Paragraph> paragraphs;

    @Singular("dataItem")
    List<DataItem> dataItems;

    @Singular("fileDefinition")
    List<FileDefinition> fileDefinitions;

    @Singular("copyDirective")
    List<CopyDirective> copyDirectives;

    /**
     * Parameters named on PROCEDURE DIVISION USING.
     */
    @Singular("usingParameter")
    List<String> procedureUsing;

    @NonNull
    @Builder.Default
    SourceMetrics metrics = SourceMetrics.EMPTY;

    @NonNull
    AnalysisDiagnostics diagnostics;

    public Optional<Division> findDivision(DivisionName name) {
        return divisions.stream().filter(d -> d.getName() == name).findFirst();
    }

    /**
     * First paragraph with the given name; duplicates carry a {@code #n} suffix and are never
     * returned for the bare name.
     */
    public Optional<Paragraph> findParagraph(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String wanted = name.toUpperCase();
        return paragraphs.stream().filter(p -> p.getName().equals(wanted)).findFirst();
    }

    /**
     * First non-FILLER data item with the given name. Qualified names ("A OF B") are matched on
     * their first component.
     */
    public Optional<DataItem> findDataItem(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String wanted = name.toUpperCase().split("\\s+(OF|IN)\\s+")[0].trim();
        return dataItems.stream()
                .filter(i -> !i.isFiller() && i.getName().equals(wanted))
                .findFirst();
    }

    public Optional<FileDefinition> findFile(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String wanted = name.toUpperCase();
        return fileDefinitions.stream().filter(f -> f.getName().equals(wanted)).findFirst();
    }

    /**
     * The file whose FD declares the given 01 record, used to map WRITE record-name to a file.
     */
    public Optional<FileDefinition> findFileByRecord(String recordName) {
        if (recordName == null) {
            return Optional.empty();
        }
        String wanted = recordName.toUpperCase();
        return fileDefinitions.stream()
                .filter(f -> f.getRecordNames().contains(wanted))
                .findFirst();
    }

    @JsonIgnore
    public List<DataItem> getItemsIn(DataSection section) {
        List<DataItem> result = new ArrayList<>();
        for (DataItem item : dataItems) {
            if (item.getSection() == section) {
                result.add(item);
            }
        }
        return result;
    }

    @JsonIgnore
    public List<DataItem> getChildren(DataItem item) {
        List<DataItem> result = new ArrayList<>(item.getChildIndices().size());
        for (int index : item.getChildIndices()) {
            result.add(dataItems.get(index));
        }
        return result;
    }

    @JsonIgnore
    public Optional<DataItem> getParent(DataItem item) {
        return item.hasParent() ? Optional.of(dataItems.get(item.getParentIndex())) : Optional.empty();
    }

    @JsonIgnore
    public boolean isCopybook() {
        return kind == ProgramKind.COPYBOOK;
    }

    /**
     * All statements in paragraph order.
     */
    @JsonIgnore
    public List<Statement> getAllStatements() {
        List<Statement> result = new ArrayList<>();
        for (Paragraph paragraph : paragraphs) {
            result.addAll(paragraph.getStatements());
        }
        return result;
    }
}
