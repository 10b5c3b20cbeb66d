package com.mainframe.analyzer.hierarchy;

import com.mainframe.analyzer.model.AnalysisDiagnostics;
import com.mainframe.analyzer.model.DataItem;
import com.mainframe.analyzer.model.DataType;
import com.mainframe.analyzer.model.DiagnosticKind;
import com.mainframe.analyzer.model.PictureClause;
import com.mainframe.analyzer.model.UsageType;
import com.mainframe.analyzer.parser.RawDataEntry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the flat list of data entries of a program into an indexed item table.
 *
 * Parent of an ordinary item is the nearest earlier item with a strictly smaller level in the same
 * data section. Level 88 attaches to the immediately preceding non-88 item, level 66 to the
 * enclosing 01 record, and levels 01 and 77 have no parent.
 */
public class DataHierarchyResolver {
    private static final Logger log = LoggerFactory.getLogger(DataHierarchyResolver.class);

    public List<DataItem> resolve(List<RawDataEntry> entries, AnalysisDiagnostics diagnostics) {
        int size = entries.size();
        int[] parents = new int[size];
        for (int i = 0; i < size; i++) {
            parents[i] = findParent(entries, i);
            RawDataEntry entry = entries.get(i);
            if (parents[i] == DataItem.NO_PARENT && entry.getLevel() != 1 && entry.getLevel() != 77) {
                diagnostics.warn(DiagnosticKind.MALFORMED_DATA_ITEM_WARNING, entry.getLineNumber(),
                        "Level " + entry.getLevel() + " item " + entry.getName() + " has no enclosing record");
            }
        }

        List<List<Integer>> children = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            children.add(new ArrayList<>());
        }
        for (int i = 0; i < size; i++) {
            if (parents[i] != DataItem.NO_PARENT) {
                children.get(parents[i]).add(i);
            }
        }

        List<DataItem.DataItemBuilder> builders = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            builders.add(describe(entries.get(i), i, parents[i], children.get(i), diagnostics));
        }

        // group lengths: children always follow their parent, so a reverse pass sees them first
        int[] lengths = new int[size];
        for (int i = size - 1; i >= 0; i--) {
            RawDataEntry entry = entries.get(i);
            DataItem.DataItemBuilder builder = builders.get(i);
            if (entry.getPicture() == null && !children.get(i).isEmpty()) {
                int total = 0;
                for (int child : children.get(i)) {
                    RawDataEntry childEntry = entries.get(child);
                    if (childEntry.getLevel() == 88 || childEntry.getLevel() == 66 || childEntry.getRedefines() != null) {
                        continue;
                    }
                    int occurs = childEntry.getOccurs() == null ? 1 : childEntry.getOccurs();
                    total += lengths[child] * occurs;
                }
                lengths[i] = total;
                builder.length(total);
            } else {
                lengths[i] = builder.build().getLength();
            }
        }

        List<DataItem> items = new ArrayList<>(size);
        for (DataItem.DataItemBuilder builder : builders) {
            items.add(builder.build());
        }
        log.debug("Resolved {} data items", items.size());
        return items;
    }

    private int findParent(List<RawDataEntry> entries, int index) {
        RawDataEntry entry = entries.get(index);
        int level = entry.getLevel();
        if (level == 1 || level == 77) {
            return DataItem.NO_PARENT;
        }
        for (int j = index - 1; j >= 0; j--) {
            RawDataEntry candidate = entries.get(j);
            if (candidate.getSection() != entry.getSection()) {
                return DataItem.NO_PARENT;
            }
            if (level == 88) {
                if (candidate.getLevel() != 88) {
                    return j;
                }
            } else if (level == 66) {
                if (candidate.getLevel() == 1) {
                    return j;
                }
            } else if (candidate.getLevel() < level) {
                return j;
            }
        }
        return DataItem.NO_PARENT;
    }

    private DataItem.DataItemBuilder describe(RawDataEntry entry, int index, int parent, List<Integer> children,
                                              AnalysisDiagnostics diagnostics) {
        DataItem.DataItemBuilder builder = DataItem.builder()
                .index(index)
                .name(entry.getName())
                .level(entry.getLevel())
                .picture(entry.getPicture())
                .usage(entry.getUsage())
                .value(entry.getValues().isEmpty() ? null : entry.getValues().get(0))
                .values(entry.getValues())
                .occurs(entry.getOccurs())
                .occursMin(entry.getOccursMin())
                .occursDependingOn(entry.getOccursDependingOn())
                .redefines(entry.getRedefines())
                .renames(entry.getRenames())
                .parentIndex(parent)
                .childIndices(children)
                .section(entry.getSection())
                .filler(entry.isFiller())
                .lineNumber(entry.getLineNumber())
                .copybook(entry.getCopybook());

        if (entry.getPicture() == null) {
            builder.dataType(typeWithoutPicture(entry.getUsage()));
            builder.length(lengthWithoutPicture(entry.getUsage()));
            return builder;
        }

        PictureClause picture = PictureClause.parse(entry.getPicture());
        if (picture == null || !picture.isValid()) {
            diagnostics.warn(DiagnosticKind.MALFORMED_DATA_ITEM_WARNING, entry.getLineNumber(),
                    "Unrecognized PICTURE '" + entry.getPicture() + "' for " + entry.getName());
            return builder.dataType(DataType.ALPHANUMERIC).length(0);
        }
        return builder
                .dataType(picture.inferDataType(entry.getUsage()))
                .length(picture.getDisplayLength())
                .editMask(picture.getEditMask());
    }

    private static DataType typeWithoutPicture(UsageType usage) {
        return switch (usage) {
            case COMP_1, COMP_2 -> DataType.DECIMAL;
            case INDEX, POINTER, BINARY -> DataType.BINARY;
            case COMP, COMP_5 -> DataType.COMP;
            case PACKED_DECIMAL -> DataType.COMP_3;
            default -> DataType.ALPHANUMERIC;
        };
    }

    private static int lengthWithoutPicture(UsageType usage) {
        return switch (usage) {
            case COMP_1, INDEX, POINTER -> 4;
            case COMP_2 -> 8;
            default -> 0;
        };
    }

    /**
     * Pre-order walk over the root items (parentless, in table order) and their children.
     * For a well-formed table the result is the declaration order.
     */
    public static List<DataItem> flatten(List<DataItem> items) {
        List<DataItem> result = new ArrayList<>(items.size());
        for (DataItem item : items) {
            if (!item.hasParent()) {
                visit(items, item, result);
            }
        }
        return result;
    }

    private static void visit(List<DataItem> items, DataItem item, List<DataItem> result) {
        result.add(item);
        for (int child : item.getChildIndices()) {
            visit(items, items.get(child), result);
        }
    }
}
