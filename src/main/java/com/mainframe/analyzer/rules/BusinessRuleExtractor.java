package com.mainframe.analyzer.rules;

import com.mainframe.analyzer.lineage.Location;
import com.mainframe.analyzer.model.DataItem;
import com.mainframe.analyzer.model.Paragraph;
import com.mainframe.analyzer.model.Program;
import com.mainframe.analyzer.model.Statement;
import com.mainframe.analyzer.model.StatementKind;
import com.mainframe.analyzer.model.payload.ArithmeticPayload;
import com.mainframe.analyzer.model.payload.CallPayload;
import com.mainframe.analyzer.model.payload.ConditionPayload;
import com.mainframe.analyzer.model.payload.InspectPayload;
import com.mainframe.analyzer.model.payload.LogicalOperator;
import com.mainframe.analyzer.model.payload.MovePayload;
import com.mainframe.analyzer.model.payload.PerformPayload;
import com.mainframe.analyzer.model.payload.StringPayload;
import com.mainframe.analyzer.model.payload.UnstringPayload;
import com.mainframe.analyzer.parser.CobolText;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Flags statements and declarations that likely encode business logic.
 *
 * Conditionals become DECISION or VALIDATION candidates, arithmetic becomes CALCULATION,
 * STRING / UNSTRING / INSPECT become TRANSFORMATION and 88-level condition names become
 * CONSTRAINT candidates. Results are heuristic; each candidate carries a confidence.
 */
public class BusinessRuleExtractor {
    private static final Logger log = LoggerFactory.getLogger(BusinessRuleExtractor.class);

    static final double DECISION_CONFIDENCE = 0.8;
    static final double CALCULATION_CONFIDENCE = 0.9;
    static final double TRANSFORMATION_CONFIDENCE = 0.7;
    static final double CONSTRAINT_CONFIDENCE = 0.6;

    private static final Set<String> VALIDATION_TESTS = Set.of("NUMERIC", "ALPHABETIC", "ALPHABETIC-LOWER",
            "ALPHABETIC-UPPER", "POSITIVE", "NEGATIVE", "ZERO", "ZEROS", "ZEROES");

    private static final Set<StatementKind> BLOCK_BOUNDARIES = Set.of(StatementKind.IF, StatementKind.ELSE,
            StatementKind.END_IF, StatementKind.EVALUATE, StatementKind.WHEN, StatementKind.END_EVALUATE);

    public List<BusinessRuleCandidate> extract(Program program) {
        IdAllocator ids = new IdAllocator(program.getProgramId());
        List<BusinessRuleCandidate> rules = new ArrayList<>();

        for (Paragraph paragraph : program.getParagraphs()) {
            List<Statement> statements = paragraph.getStatements();
            for (int i = 0; i < statements.size(); i++) {
                Statement statement = statements.get(i);
                Location location = new Location(program.getProgramId(), paragraph.getName(), statement.getLineNumber());
                StatementKind kind = statement.getKind();
                if (kind == StatementKind.IF || kind == StatementKind.EVALUATE || kind == StatementKind.WHEN) {
                    rules.add(fromCondition(statement, statements.subList(i + 1, statements.size()), location, ids));
                } else if (kind.isArithmetic()) {
                    rules.add(fromCalculation(statement, location, ids));
                } else if (kind == StatementKind.STRING || kind == StatementKind.UNSTRING
                        || kind == StatementKind.INSPECT) {
                    rules.add(fromTransformation(statement, location, ids));
                }
            }
        }

        for (DataItem item : program.getDataItems()) {
            if (item.isConditionName() && !item.getValues().isEmpty()) {
                rules.add(fromConditionName(program, item, ids));
            }
        }

        log.debug("Extracted {} rule candidates from {}", rules.size(), program.getProgramId());
        return rules;
    }

    private BusinessRuleCandidate fromCondition(Statement statement, List<Statement> following, Location location,
                                                IdAllocator ids) {
        ConditionPayload condition = statement.payloadAs(ConditionPayload.class);
        List<String> predicates = condition != null ? condition.getConditions() : List.of();
        LogicalOperator operator = condition != null ? condition.getOperator() : LogicalOperator.AND;
        String content = statement.getContent();

        BusinessRuleCandidate.BusinessRuleCandidateBuilder rule = BusinessRuleCandidate.builder()
                .id(ids.next(location))
                .kind(isValidation(statement) ? RuleKind.VALIDATION : RuleKind.DECISION)
                .category(RuleCategory.infer(content))
                .description("Conditional logic in " + location.getParagraph())
                .naturalLanguage("When " + describe(content) + ", the system performs the specified action.")
                .conditions(ConditionParser.parseAll(predicates, operator))
                .dataInvolved(statement.getDataReferences())
                .location(location)
                .confidence(DECISION_CONFIDENCE)
                .impact(RuleImpact.assess(content));

        if (condition != null && condition.getTruthPath() != null) {
            Action inline = inlineAction(condition.getTruthPath());
            if (inline != null) {
                rule.action(inline);
            }
        }
        if (statement.getKind() != StatementKind.EVALUATE) {
            for (Statement next : following) {
                if (BLOCK_BOUNDARIES.contains(next.getKind())) {
                    break;
                }
                Action action = toAction(next);
                if (action != null) {
                    rule.action(action);
                }
                if (next.getContent().trim().endsWith(".")) {
                    break;
                }
            }
        }
        return rule.build();
    }

    private BusinessRuleCandidate fromCalculation(Statement statement, Location location, IdAllocator ids) {
        ArithmeticPayload arithmetic = statement.payloadAs(ArithmeticPayload.class);
        String content = statement.getContent();
        String formula = arithmetic != null && arithmetic.getFormula() != null ? arithmetic.getFormula() : content;
        List<String> results = arithmetic != null ? arithmetic.getResults() : List.of();
        List<String> operands = new ArrayList<>();
        if (arithmetic != null) {
            for (String operand : arithmetic.getOperands()) {
                if (CobolText.isIdentifier(operand)) {
                    operands.add(operand);
                }
            }
        }
        Set<String> involved = new LinkedHashSet<>(operands);
        involved.addAll(results);

        BusinessRuleCandidate.BusinessRuleCandidateBuilder rule = BusinessRuleCandidate.builder()
                .id(ids.next(location))
                .kind(RuleKind.CALCULATION)
                .category(RuleCategory.infer(content))
                .description("Calculation: " + formula)
                .naturalLanguage("Calculate " + String.join(", ", results) + " by evaluating the formula: " + formula)
                .dataInvolved(involved)
                .dependencies(operands)
                .location(location)
                .confidence(CALCULATION_CONFIDENCE)
                .impact(RuleImpact.assess(content));
        for (String result : results) {
            rule.action(Action.builder().type(ActionType.COMPUTE).target(result).value(formula).build());
        }
        return rule.build();
    }

    private BusinessRuleCandidate fromTransformation(Statement statement, Location location, IdAllocator ids) {
        String content = statement.getContent();
        List<String> inputs = new ArrayList<>();
        List<String> outputs = new ArrayList<>();
        StringPayload string = statement.payloadAs(StringPayload.class);
        UnstringPayload unstring = statement.payloadAs(UnstringPayload.class);
        InspectPayload inspect = statement.payloadAs(InspectPayload.class);
        if (string != null) {
            string.getSources().stream().filter(CobolText::isIdentifier).forEach(inputs::add);
            addIfPresent(outputs, string.getTarget());
        } else if (unstring != null) {
            addIfPresent(inputs, unstring.getSource());
            outputs.addAll(unstring.getTargets());
        } else if (inspect != null) {
            addIfPresent(inputs, inspect.getTarget());
            addIfPresent(outputs, inspect.getMode() == InspectPayload.Mode.TALLYING
                    ? inspect.getTallyingField() : inspect.getTarget());
        }

        String verb = statement.getKind().getVerb();
        BusinessRuleCandidate.BusinessRuleCandidateBuilder rule = BusinessRuleCandidate.builder()
                .id(ids.next(location))
                .kind(RuleKind.TRANSFORMATION)
                .category(RuleCategory.infer(content))
                .description(verb + " transformation into " + (outputs.isEmpty() ? "?" : String.join(", ", outputs)))
                .naturalLanguage("Derive " + String.join(", ", outputs) + " from " + String.join(", ", inputs)
                        + " using " + verb)
                .dataInvolved(statement.getDataReferences())
                .dependencies(inputs)
                .location(location)
                .confidence(TRANSFORMATION_CONFIDENCE)
                .impact(RuleImpact.assess(content));
        for (String output : outputs) {
            rule.action(Action.builder().type(ActionType.MOVE).target(output).value(String.join(" ", inputs)).build());
        }
        return rule.build();
    }

    private BusinessRuleCandidate fromConditionName(Program program, DataItem item, IdAllocator ids) {
        String field = program.getParent(item).map(DataItem::getName).orElse(item.getName());
        String section = item.getSection() != null ? item.getSection().getCobolName() : "DATA";
        Location location = new Location(program.getProgramId(), section, item.getLineNumber());
        String values = String.join(", ", item.getValues());
        String cueText = item.getName() + " " + field;

        List<Condition> conditions = new ArrayList<>();
        for (int i = 0; i < item.getValues().size(); i++) {
            conditions.add(new Condition(field, "=", item.getValues().get(i), i == 0 ? null : LogicalOperator.OR));
        }
        return BusinessRuleCandidate.builder()
                .id(ids.next(location))
                .kind(RuleKind.CONSTRAINT)
                .category(RuleCategory.infer(cueText))
                .description(item.getName() + ": " + field + " in [" + values + "]")
                .naturalLanguage(field + " is " + describe(item.getName()) + " when it holds " + values)
                .conditions(conditions)
                .involvedField(field)
                .involvedField(item.getName())
                .location(location)
                .confidence(CONSTRAINT_CONFIDENCE)
                .impact(RuleImpact.assess(cueText))
                .build();
    }

    private static boolean isValidation(Statement statement) {
        for (String word : CobolText.tokenize(CobolText.stripLiterals(statement.getContent()))) {
            String w = CobolText.stripTerminator(word);
            if (VALIDATION_TESTS.contains(w)) {
                return true;
            }
        }
        for (String field : statement.getDataReferences()) {
            if (field.contains("VALID")) {
                return true;
            }
        }
        return false;
    }

    private static Action toAction(Statement statement) {
        switch (statement.getKind()) {
            case MOVE: {
                MovePayload move = statement.payloadAs(MovePayload.class);
                if (move == null || move.getTargets().isEmpty()) {
                    return null;
                }
                List<String> from = new ArrayList<>(move.getSources());
                from.addAll(move.getLiterals());
                return Action.builder().type(ActionType.MOVE).target(move.getTargets().get(0))
                        .value(String.join(" ", from)).parameters(move.getTargets()).build();
            }
            case SET: {
                List<String> refs = statement.getDataReferences();
                return Action.builder().type(ActionType.SET).target(refs.isEmpty() ? null : refs.get(0))
                        .value(afterWord(statement.getContent(), "TO")).build();
            }
            case COMPUTE:
            case ADD:
            case SUBTRACT:
            case MULTIPLY:
            case DIVIDE: {
                ArithmeticPayload arithmetic = statement.payloadAs(ArithmeticPayload.class);
                String target = arithmetic != null && !arithmetic.getResults().isEmpty()
                        ? arithmetic.getResults().get(0) : null;
                return Action.builder().type(ActionType.COMPUTE).target(target)
                        .value(arithmetic != null ? arithmetic.getFormula() : null).build();
            }
            case DISPLAY:
                return Action.builder().type(ActionType.DISPLAY)
                        .value(statement.getContent().trim().substring("DISPLAY".length()).trim())
                        .parameters(statement.getDataReferences()).build();
            case CALL: {
                CallPayload call = statement.payloadAs(CallPayload.class);
                return call == null ? null
                        : Action.builder().type(ActionType.CALL).target(call.getTarget()).parameters(call.getUsing()).build();
            }
            case PERFORM: {
                PerformPayload perform = statement.payloadAs(PerformPayload.class);
                return perform == null || perform.getTarget() == null ? null
                        : Action.builder().type(ActionType.PERFORM).target(perform.getTarget()).build();
            }
            default:
                return null;
        }
    }

    private static Action inlineAction(String truthPath) {
        String[] words = truthPath.trim().split("\\s+", 2);
        StatementKind kind = StatementKind.fromVerb(words[0]);
        if (kind == null) {
            return null;
        }
        String rest = words.length > 1 ? CobolText.stripTerminator(words[1]) : "";
        switch (kind) {
            case MOVE:
                return Action.builder().type(ActionType.MOVE).target(afterWord(rest, "TO"))
                        .value(beforeWord(rest, "TO")).build();
            case SET:
                return Action.builder().type(ActionType.SET).target(beforeWord(rest, "TO"))
                        .value(afterWord(rest, "TO")).build();
            case COMPUTE:
            case ADD:
            case SUBTRACT:
            case MULTIPLY:
            case DIVIDE:
                return Action.builder().type(ActionType.COMPUTE).value(truthPath.trim()).build();
            case DISPLAY:
                return Action.builder().type(ActionType.DISPLAY).value(rest).build();
            case CALL:
                return Action.builder().type(ActionType.CALL).target(CobolText.unquote(beforeWord(rest, "USING"))).build();
            case PERFORM:
                return Action.builder().type(ActionType.PERFORM).target(rest.split("\\s+")[0]).build();
            default:
                return null;
        }
    }

    private static String beforeWord(String text, String word) {
        int at = CobolText.indexOutsideLiterals(text, " " + word + " ");
        return (at >= 0 ? text.substring(0, at) : text).trim();
    }

    private static String afterWord(String text, String word) {
        int at = CobolText.indexOutsideLiterals(text, " " + word + " ");
        return at >= 0 ? CobolText.stripTerminator(text.substring(at + word.length() + 2).trim()) : null;
    }

    private static void addIfPresent(List<String> list, String value) {
        if (value != null) {
            list.add(value);
        }
    }

    private static String describe(String content) {
        return CobolText.stripTerminator(content.trim()).toLowerCase(Locale.ROOT);
    }

    /**
     * Hands out rule ids; the second and later rules on the same line get a {@code -n} suffix.
     */
    private static final class IdAllocator {
        private final String programId;
        private final Map<String, Integer> seen = new HashMap<>();

        IdAllocator(String programId) {
            this.programId = programId;
        }

        String next(Location location) {
            String base = "BR-" + programId + "-" + location.getParagraph() + "-" + location.getLineNumber();
            int count = seen.merge(base, 1, Integer::sum);
            return count == 1 ? base : base + "-" + count;
        }
    }
}
