package com.mainframe.analyzer.lineage;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Every file operation of one program or a whole batch, with its CRUD roll-up.
 */
@Value
public class FileIoMap {

    List<FileOperation> operations;
    CrudMatrix crudMatrix;

    public static FileIoMap of(List<FileOperation> operations) {
        return new FileIoMap(List.copyOf(operations), CrudMatrix.of(operations));
    }

    public static FileIoMap merge(List<FileIoMap> maps) {
        List<FileOperation> all = new ArrayList<>();
        for (FileIoMap map : maps) {
            all.addAll(map.getOperations());
        }
        return of(all);
    }
}
