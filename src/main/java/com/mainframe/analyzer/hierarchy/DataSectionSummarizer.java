package com.mainframe.analyzer.hierarchy;

import com.mainframe.analyzer.model.DataItem;
import com.mainframe.analyzer.model.DataSection;
import com.mainframe.analyzer.model.DataType;
import com.mainframe.analyzer.model.Program;

import java.util.List;
import java.util.Locale;

/**
 * Builds the WORKING-STORAGE and LINKAGE summaries of a resolved program.
 */
public class DataSectionSummarizer {

    public WorkingStorageSummary summarizeWorkingStorage(Program program) {
        List<DataItem> items = program.getItemsIn(DataSection.WORKING_STORAGE);
        WorkingStorageSummary.WorkingStorageSummaryBuilder builder = WorkingStorageSummary.builder()
                .itemCount(items.size());

        for (DataItem item : items) {
            if (item.getValue() != null && !item.isConditionName()) {
                builder.constant(new WorkingStorageSummary.Constant(
                        item.getName(), item.getValue(), item.getDataType().getCobolName()));
            }
            boolean flag = item.isConditionName()
                    || (item.getValue() != null && item.getDataType() == DataType.ALPHANUMERIC && item.getLength() == 1);
            if (flag) {
                builder.flag(WorkingStorageSummary.Flag.builder()
                        .name(item.getName())
                        .field(item.isConditionName()
                                ? program.getParent(item).map(DataItem::getName).orElse(null)
                                : null)
                        .values(item.getValues())
                        .purpose(inferFlagPurpose(item.getName()))
                        .build());
            }
        }
        return builder.build();
    }

    public LinkageSummary summarizeLinkage(Program program) {
        LinkageSummary.LinkageSummaryBuilder builder = LinkageSummary.builder()
                .procedureUsing(program.getProcedureUsing());
        int total = 0;
        for (DataItem item : program.getItemsIn(DataSection.LINKAGE)) {
            if (!item.hasParent() && (item.getLevel() == 1 || item.getLevel() == 77)) {
                builder.parameter(item.getName());
                total += item.getLength();
            }
        }
        return builder.totalLength(total).build();
    }

    static String inferFlagPurpose(String flagName) {
        String name = flagName.toLowerCase(Locale.ROOT);
        if (name.contains("err")) {
            return "Error handling";
        }
        if (name.contains("eof") || name.contains("end")) {
            return "End of file";
        }
        if (name.contains("found") || name.contains("exists")) {
            return "Record existence";
        }
        if (name.contains("valid")) {
            return "Validation";
        }
        return null;
    }
}
