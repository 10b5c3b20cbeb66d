package com.mainframe.analyzer.lineage;

import com.mainframe.analyzer.model.CopyDirective;
import com.mainframe.analyzer.model.DataItem;
import com.mainframe.analyzer.model.DataSection;
import com.mainframe.analyzer.model.FileDefinition;
import com.mainframe.analyzer.model.Paragraph;
import com.mainframe.analyzer.model.Program;
import com.mainframe.analyzer.model.Statement;
import com.mainframe.analyzer.model.StatementKind;
import com.mainframe.analyzer.model.payload.ArithmeticPayload;
import com.mainframe.analyzer.model.payload.CallPayload;
import com.mainframe.analyzer.model.payload.ConditionPayload;
import com.mainframe.analyzer.model.payload.FileIoPayload;
import com.mainframe.analyzer.model.payload.GoToPayload;
import com.mainframe.analyzer.model.payload.InspectPayload;
import com.mainframe.analyzer.model.payload.MovePayload;
import com.mainframe.analyzer.model.payload.PerformPayload;
import com.mainframe.analyzer.model.payload.StringPayload;
import com.mainframe.analyzer.model.payload.UnstringPayload;
import com.mainframe.analyzer.parser.CobolText;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Derives field-level data flow, sources and sinks, the where-used index and file I/O of a
 * program from its classified statements.
 */
public class DataLineageAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(DataLineageAnalyzer.class);

    public ProgramLineage analyze(Program program) {
        Walk walk = new Walk(program);
        walk.run();
        DataLineage lineage = walk.lineage.build();
        log.debug("Lineage for {}: {} flows, {} file operations", program.getProgramId(),
                lineage.getFlows().size(), walk.fileOperations.size());
        return new ProgramLineage(lineage, walk.whereUsed.build(), FileIoMap.of(walk.fileOperations));
    }

    /**
     * Where-used context of a field referenced by a statement of the given kind.
     */
    static ReferenceContext contextOf(StatementKind kind) {
        return switch (kind) {
            case READ -> ReferenceContext.READ;
            case WRITE, REWRITE -> ReferenceContext.WRITE;
            case IF, EVALUATE, WHEN -> ReferenceContext.CONDITION;
            case COMPUTE, ADD, SUBTRACT, MULTIPLY, DIVIDE -> ReferenceContext.COMPUTE;
            case PERFORM -> ReferenceContext.PERFORM;
            case CALL -> ReferenceContext.CALL;
            default -> ReferenceContext.READ;
        };
    }

    /**
     * One enclosing IF or EVALUATE. {@code text} is the predicate active for the statements
     * currently being visited.
     */
    private static final class ConditionFrame {
        final boolean evaluate;
        final String subject;
        String text;

        ConditionFrame(boolean evaluate, String subject, String text) {
            this.evaluate = evaluate;
            this.subject = subject;
            this.text = text;
        }
    }

    private static final class Walk {
        private final Program program;
        private final String programId;
        private final DataLineage.DataLineageBuilder lineage;
        private final WhereUsedIndex.Accumulator whereUsed = new WhereUsedIndex.Accumulator();
        private final List<FileOperation> fileOperations = new ArrayList<>();
        private final Set<String> linkageSinks = new LinkedHashSet<>();
        private final Deque<ConditionFrame> conditions = new ArrayDeque<>();

        Walk(Program program) {
            this.program = program;
            this.programId = program.getProgramId();
            this.lineage = DataLineage.builder().programId(programId);
        }

        void run() {
            for (DataItem item : program.getItemsIn(DataSection.LINKAGE)) {
                if (!item.isFiller() && !item.hasParent() && !item.isConditionName()) {
                    lineage.source(new DataSource(DataSource.Kind.LINKAGE, item.getName(), null,
                            new Location(programId, null, item.getLineNumber())));
                }
            }
            for (CopyDirective copy : program.getCopyDirectives()) {
                whereUsed.copybook(copy.getCopybookName(),
                        new Reference(programId, copyLocation(copy), copy.getLineNumber(), ReferenceContext.READ));
            }
            for (Paragraph paragraph : program.getParagraphs()) {
                conditions.clear();
                for (Statement statement : paragraph.getStatements()) {
                    visit(paragraph, statement);
                }
            }
        }

        private void visit(Paragraph paragraph, Statement statement) {
            Location location = new Location(programId, paragraph.getName(), statement.getLineNumber());
            indexDataReferences(statement, location);

            switch (statement.getKind()) {
                case MOVE -> move(statement.payloadAs(MovePayload.class), location);
                case COMPUTE, ADD, SUBTRACT, MULTIPLY, DIVIDE ->
                        arithmetic(statement.getKind(), statement.payloadAs(ArithmeticPayload.class), location);
                case STRING -> string(statement.payloadAs(StringPayload.class), location);
                case UNSTRING -> unstring(statement.payloadAs(UnstringPayload.class), location);
                case INSPECT -> inspect(statement.payloadAs(InspectPayload.class), location);
                case READ, WRITE, REWRITE, DELETE, START, OPEN, CLOSE ->
                        fileIo(statement.payloadAs(FileIoPayload.class), location);
                case DISPLAY -> {
                    for (String field : statement.getDataReferences()) {
                        lineage.sink(new DataSink(DataSink.Kind.DISPLAY, field, null, location));
                    }
                }
                case CALL -> call(statement.payloadAs(CallPayload.class), location);
                case PERFORM -> perform(statement.payloadAs(PerformPayload.class), location);
                case GO_TO -> goTo(statement.payloadAs(GoToPayload.class), location);
                default -> {
                }
            }

            trackConditions(statement);
        }

        private void indexDataReferences(Statement statement, Location location) {
            Set<String> moveTargets = Set.of();
            MovePayload move = statement.payloadAs(MovePayload.class);
            if (move != null) {
                moveTargets = new LinkedHashSet<>(move.getTargets());
            }
            ReferenceContext context = contextOf(statement.getKind());
            for (String field : statement.getDataReferences()) {
                ReferenceContext actual = context;
                if (move != null) {
                    actual = moveTargets.contains(field) ? ReferenceContext.WRITE : ReferenceContext.COMPUTE;
                }
                whereUsed.dataItem(field, reference(location, actual));
            }
        }

        private void move(MovePayload move, Location location) {
            if (move == null) {
                return;
            }
            TransformationKind kind = move.isReferenceModified() ? TransformationKind.REF_MOD : TransformationKind.MOVE;
            for (String target : move.getTargets()) {
                for (String source : move.getSources()) {
                    flow(source, target, kind, location);
                }
                for (String literal : move.getLiterals()) {
                    lineage.source(new DataSource(DataSource.Kind.LITERAL, target, literal, location));
                }
                noteLinkageWrite(target, location);
            }
        }

        private void arithmetic(StatementKind kind, ArithmeticPayload arithmetic, Location location) {
            if (arithmetic == null) {
                return;
            }
            List<String> inputs = new ArrayList<>();
            for (String operand : arithmetic.getOperands()) {
                if (CobolText.isIdentifier(operand)) {
                    inputs.add(operand);
                }
            }
            for (String result : arithmetic.getResults()) {
                for (String input : inputs) {
                    if (!input.equals(result)) {
                        flow(input, result, TransformationKind.COMPUTE, location);
                    }
                }
                lineage.source(new DataSource(DataSource.Kind.COMPUTED, result, arithmetic.getFormula(), location));
                noteLinkageWrite(result, location);
            }
            lineage.transformation(DataTransformation.builder()
                    .operation(kind)
                    .inputs(inputs)
                    .outputs(arithmetic.getResults())
                    .formula(arithmetic.getFormula())
                    .location(location)
                    .build());
        }

        private void string(StringPayload string, Location location) {
            if (string == null || string.getTarget() == null) {
                return;
            }
            for (String source : string.getSources()) {
                if (CobolText.isIdentifier(source)) {
                    flow(source, string.getTarget(), TransformationKind.STRING, location);
                }
            }
            noteLinkageWrite(string.getTarget(), location);
        }

        private void unstring(UnstringPayload unstring, Location location) {
            if (unstring == null || unstring.getSource() == null) {
                return;
            }
            for (String target : unstring.getTargets()) {
                flow(unstring.getSource(), target, TransformationKind.UNSTRING, location);
                noteLinkageWrite(target, location);
            }
        }

        private void inspect(InspectPayload inspect, Location location) {
            if (inspect == null || inspect.getTarget() == null || inspect.getMode() == InspectPayload.Mode.TALLYING) {
                return;
            }
            flow(inspect.getTarget(), inspect.getTarget(), TransformationKind.INSPECT, location);
        }

        private void fileIo(FileIoPayload io, Location location) {
            if (io == null) {
                return;
            }
            StatementKind operation = io.getOperation();
            ReferenceContext context = switch (operation) {
                case WRITE, REWRITE, DELETE -> ReferenceContext.WRITE;
                default -> ReferenceContext.READ;
            };

            if (operation == StatementKind.WRITE || operation == StatementKind.REWRITE) {
                String record = io.getRecordName();
                if (record == null) {
                    return;
                }
                Optional<FileDefinition> file = program.findFileByRecord(record);
                String fileName = file.map(FileDefinition::getName).orElse(record);
                fileOperations.add(FileOperation.builder()
                        .fileName(fileName)
                        .operation(operation)
                        .location(location)
                        .recordType(record)
                        .keyFields(keyFields(file, io))
                        .build());
                whereUsed.file(fileName, reference(location, context));
                String written = io.getFromField() != null ? io.getFromField() : record;
                lineage.sink(new DataSink(DataSink.Kind.FILE_OUTPUT, written, fileName, location));
                return;
            }

            List<String> names = io.getFileNames();
            for (int i = 0; i < names.size(); i++) {
                String fileName = names.get(i);
                Optional<FileDefinition> file = program.findFile(fileName);
                String record = file.flatMap(f -> f.getRecordNames().stream().findFirst()).orElse(null);
                fileOperations.add(FileOperation.builder()
                        .fileName(fileName)
                        .operation(operation)
                        .location(location)
                        .recordType(operation == StatementKind.OPEN || operation == StatementKind.CLOSE ? null : record)
                        .keyFields(operation == StatementKind.OPEN || operation == StatementKind.CLOSE
                                ? List.of() : keyFields(file, io))
                        .openMode(i < io.getOpenModes().size() ? io.getOpenModes().get(i) : null)
                        .build());
                whereUsed.file(fileName, reference(location, context));

                if (operation == StatementKind.READ) {
                    if (io.getIntoField() != null) {
                        lineage.source(new DataSource(DataSource.Kind.FILE_INPUT, io.getIntoField(), fileName, location));
                    } else {
                        for (String recordName : file.map(FileDefinition::getRecordNames).orElse(List.of())) {
                            lineage.source(new DataSource(DataSource.Kind.FILE_INPUT, recordName, fileName, location));
                        }
                    }
                }
            }
        }

        private List<String> keyFields(Optional<FileDefinition> file, FileIoPayload io) {
            if (io.getKeyField() != null) {
                return List.of(io.getKeyField());
            }
            return file.map(FileDefinition::getRecordKey).map(List::of).orElse(List.of());
        }

        private void call(CallPayload call, Location location) {
            if (call == null) {
                return;
            }
            for (String argument : call.getUsing()) {
                if (CobolText.isIdentifier(argument)) {
                    lineage.sink(new DataSink(DataSink.Kind.CALL_PARAMETER, argument, call.getTarget(), location));
                }
            }
        }

        private void perform(PerformPayload perform, Location location) {
            if (perform == null || perform.getTarget() == null) {
                return;
            }
            whereUsed.paragraph(perform.getTarget(), reference(location, ReferenceContext.PERFORM));
            if (perform.getThruTarget() != null) {
                whereUsed.paragraph(perform.getThruTarget(), reference(location, ReferenceContext.PERFORM));
            }
        }

        private void goTo(GoToPayload goTo, Location location) {
            if (goTo == null) {
                return;
            }
            for (String target : goTo.getTargets()) {
                whereUsed.paragraph(target, reference(location, ReferenceContext.PERFORM));
            }
        }

        private void flow(String source, String target, TransformationKind kind, Location location) {
            List<String> active = new ArrayList<>();
            Iterator<ConditionFrame> outermostFirst = conditions.descendingIterator();
            while (outermostFirst.hasNext()) {
                active.add(outermostFirst.next().text);
            }
            lineage.flow(DataFlowEdge.builder()
                    .sourceField(source)
                    .targetField(target)
                    .transformation(kind)
                    .location(location)
                    .conditions(active)
                    .build());
        }

        private void noteLinkageWrite(String field, Location location) {
            boolean linkage = program.findDataItem(field)
                    .map(item -> item.getSection() == DataSection.LINKAGE)
                    .orElse(false);
            if (linkage && linkageSinks.add(field)) {
                lineage.sink(new DataSink(DataSink.Kind.LINKAGE, field, null, location));
            }
        }

        /**
         * Maintains the enclosing predicates: IF and EVALUATE open a frame, ELSE negates it, WHEN
         * replaces it, END-IF / END-EVALUATE close it, and a sentence period closes all of them.
         */
        private void trackConditions(Statement statement) {
            ConditionPayload condition = statement.payloadAs(ConditionPayload.class);
            switch (statement.getKind()) {
                case IF -> {
                    if (condition != null) {
                        conditions.push(new ConditionFrame(false, null, predicate(condition)));
                    }
                }
                case ELSE -> {
                    ConditionFrame top = innermost(false);
                    if (top != null) {
                        top.text = "NOT (" + top.text + ")";
                    }
                }
                case END_IF -> popUntil(false);
                case EVALUATE -> {
                    String subject = condition != null ? condition.getSubject() : null;
                    conditions.push(new ConditionFrame(true, subject, "EVALUATE " + subject));
                }
                case WHEN -> {
                    ConditionFrame top = innermost(true);
                    if (top != null && condition != null) {
                        String when = predicate(condition);
                        top.text = top.subject == null || "TRUE".equals(top.subject) || "OTHER".equals(when)
                                ? when : top.subject + " = " + when;
                    }
                }
                case END_EVALUATE -> popUntil(true);
                default -> {
                }
            }
            if (statement.getContent().trim().endsWith(".")) {
                conditions.clear();
            }
        }

        private ConditionFrame innermost(boolean evaluate) {
            for (ConditionFrame frame : conditions) {
                if (frame.evaluate == evaluate) {
                    return frame;
                }
            }
            return null;
        }

        private void popUntil(boolean evaluate) {
            while (!conditions.isEmpty()) {
                if (conditions.pop().evaluate == evaluate) {
                    return;
                }
            }
        }

        private Reference reference(Location location, ReferenceContext context) {
            return new Reference(programId, location.getParagraph(), location.getLineNumber(), context);
        }

        private static String predicate(ConditionPayload condition) {
            return String.join(" " + condition.getOperator().name() + " ", condition.getConditions());
        }

        private static String copyLocation(CopyDirective copy) {
            if (copy.getDivision() == null) {
                return copy.getSection();
            }
            return copy.getSection() == null ? copy.getDivision().name() : copy.getDivision().name() + "/" + copy.getSection();
        }
    }
}
