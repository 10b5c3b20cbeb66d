package com.mainframe.analyzer.parser;

import com.mainframe.analyzer.model.Statement;
import com.mainframe.analyzer.model.StatementKind;
import com.mainframe.analyzer.model.payload.ArithmeticPayload;
import com.mainframe.analyzer.model.payload.CallPayload;
import com.mainframe.analyzer.model.payload.ConditionPayload;
import com.mainframe.analyzer.model.payload.ExecPayload;
import com.mainframe.analyzer.model.payload.FileIoPayload;
import com.mainframe.analyzer.model.payload.GoToPayload;
import com.mainframe.analyzer.model.payload.InspectPayload;
import com.mainframe.analyzer.model.payload.LogicalOperator;
import com.mainframe.analyzer.model.payload.MovePayload;
import com.mainframe.analyzer.model.payload.NoPayload;
import com.mainframe.analyzer.model.payload.PerformPayload;
import com.mainframe.analyzer.model.payload.StatementPayload;
import com.mainframe.analyzer.model.payload.StringPayload;
import com.mainframe.analyzer.model.payload.UnstringPayload;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps the text of one procedure statement to its kind, payload and data references.
 *
 * Classification is by leading verb only and is deterministic; text that does not start with a
 * known verb becomes {@link StatementKind#OTHER} with reduced confidence.
 */
public class StatementClassifier {
    private static final Logger log = LoggerFactory.getLogger(StatementClassifier.class);

    private static final Pattern SQL_TABLE =
            Pattern.compile("\\b(?:FROM|INTO|UPDATE|JOIN|TABLE)\\s+([A-Z][A-Z0-9_]*(?:\\.[A-Z][A-Z0-9_]*)?)");
    private static final Pattern HOST_VARIABLE = Pattern.compile(":([A-Z0-9][A-Z0-9-]*)");

    private static final Set<String> ARITHMETIC_STOP = Set.of("ON", "SIZE", "NOT");
    private static final Set<String> FILE_IO_STOP = Set.of("AT", "INVALID", "NOT", "END");
    private static final Set<String> CALL_STOP = Set.of("RETURNING", "GIVING", "ON", "NOT", "EXCEPTION", "OVERFLOW");
    private static final Set<String> OPEN_MODES = Set.of("INPUT", "OUTPUT", "I-O", "EXTEND");

    public Statement classify(String content, int lineNumber) {
        String text = content.trim();
        String body = stripSentencePeriod(text);
        List<String> tokens = CobolText.tokenize(body);

        StatementKind kind = tokens.isEmpty() ? null : StatementKind.fromVerb(CobolText.stripTerminator(tokens.get(0)));
        if (kind == null || kind == StatementKind.OTHER) {
            log.debug("Unclassified statement at line {}: {}", lineNumber, text);
            return Statement.builder()
                    .kind(StatementKind.OTHER)
                    .lineNumber(lineNumber)
                    .content(text)
                    .dataReferences(CobolText.identifiers(body))
                    .confidence(Statement.UNRECOGNIZED_CONFIDENCE)
                    .build();
        }

        List<String> rest = clean(tokens.subList(1, tokens.size()));
        String restText = String.join(" ", rest);
        Set<String> excluded = new LinkedHashSet<>();
        StatementPayload payload;

        switch (kind) {
            case MOVE -> payload = move(rest);
            case COMPUTE -> payload = compute(restText);
            case ADD, SUBTRACT, MULTIPLY, DIVIDE -> payload = arithmetic(kind, rest);
            case IF, WHEN -> payload = condition(rest, null);
            case EVALUATE -> payload = condition(rest, restText);
            case PERFORM -> {
                PerformPayload perform = perform(rest);
                if (perform.getTarget() != null) {
                    excluded.add(perform.getTarget());
                }
                if (perform.getThruTarget() != null) {
                    excluded.add(perform.getThruTarget());
                }
                payload = perform;
            }
            case GO_TO -> {
                GoToPayload goTo = goTo(rest);
                excluded.addAll(goTo.getTargets());
                payload = goTo;
            }
            case CALL -> payload = call(rest);
            case READ, DELETE, START, OPEN, CLOSE -> {
                FileIoPayload io = fileIo(kind, rest);
                excluded.addAll(io.getFileNames());
                payload = io;
            }
            case WRITE, REWRITE -> payload = fileIo(kind, rest);
            case STRING -> payload = stringPayload(rest);
            case UNSTRING -> payload = unstringPayload(rest);
            case INSPECT -> payload = inspect(rest);
            case EXEC -> payload = exec(rest, restText);
            default -> payload = NoPayload.INSTANCE;
        }

        List<String> references;
        if (kind == StatementKind.COPY) {
            references = List.of();
        } else if (payload instanceof ExecPayload execPayload) {
            references = execPayload.getHostVariables();
        } else {
            references = new ArrayList<>(CobolText.identifiers(restText));
            references.removeAll(excluded);
        }

        return Statement.builder()
                .kind(kind)
                .lineNumber(lineNumber)
                .content(text)
                .payload(payload)
                .dataReferences(references)
                .confidence(Statement.RECOGNIZED_CONFIDENCE)
                .build();
    }

    private MovePayload move(List<String> rest) {
        MovePayload.MovePayloadBuilder builder = MovePayload.builder();
        List<String> operands = rest;
        if (!operands.isEmpty() && (operands.get(0).equals("CORRESPONDING") || operands.get(0).equals("CORR"))) {
            builder.corresponding(true);
            operands = operands.subList(1, operands.size());
        }
        int to = operands.indexOf("TO");
        List<String> sources = to >= 0 ? operands.subList(0, to) : operands;
        List<String> targets = to >= 0 ? operands.subList(to + 1, operands.size()) : List.of();

        boolean refMod = false;
        for (String operand : unqualified(sources)) {
            if (CobolText.isLiteral(operand)) {
                builder.literal(operand);
            } else if (CobolText.isIdentifier(CobolText.baseName(operand))) {
                builder.source(CobolText.baseName(operand));
                refMod |= CobolText.isReferenceModified(operand);
            }
        }
        for (String operand : unqualified(targets)) {
            if (CobolText.isIdentifier(CobolText.baseName(operand))) {
                builder.target(CobolText.baseName(operand));
                refMod |= CobolText.isReferenceModified(operand);
            }
        }
        return builder.referenceModified(refMod).build();
    }

    private ArithmeticPayload compute(String restText) {
        ArithmeticPayload.ArithmeticPayloadBuilder builder = ArithmeticPayload.builder()
                .operation(StatementKind.COMPUTE);
        int eq = CobolText.indexOutsideLiterals(restText, "=");
        String left = eq >= 0 ? restText.substring(0, eq) : restText;
        String right = eq >= 0 ? restText.substring(eq + 1) : "";
        // EQUAL is the long form of =
        if (eq < 0) {
            int equal = CobolText.indexOutsideLiterals(restText, " EQUAL ");
            if (equal >= 0) {
                left = restText.substring(0, equal);
                right = restText.substring(equal + " EQUAL ".length());
            }
        }
        right = cutAt(right, " ON SIZE", " SIZE ERROR", " NOT ON", " NOT SIZE").trim();

        for (String token : CobolText.tokenize(left)) {
            if (token.equals("ROUNDED")) {
                builder.rounded(true);
            } else if (CobolText.isIdentifier(CobolText.baseName(token))) {
                builder.result(CobolText.baseName(token));
            }
        }
        builder.operands(CobolText.identifiers(right));
        builder.formula(right);
        return builder.build();
    }

    private ArithmeticPayload arithmetic(StatementKind kind, List<String> rest) {
        List<String> tokens = truncate(rest, ARITHMETIC_STOP);
        String separator = switch (kind) {
            case ADD -> "TO";
            case SUBTRACT -> "FROM";
            case MULTIPLY -> "BY";
            default -> tokens.contains("INTO") ? "INTO" : "BY";
        };

        int sep = tokens.indexOf(separator);
        int giving = tokens.indexOf("GIVING");
        int remainder = tokens.indexOf("REMAINDER");
        int rightEnd = giving >= 0 ? giving : (remainder >= 0 ? remainder : tokens.size());

        List<String> left = sep >= 0 ? tokens.subList(0, sep) : tokens.subList(0, rightEnd);
        List<String> right = sep >= 0 ? tokens.subList(sep + 1, rightEnd) : List.of();
        List<String> givingPart = giving >= 0
                ? tokens.subList(giving + 1, remainder > giving ? remainder : tokens.size())
                : List.of();
        List<String> remainderPart = remainder >= 0 ? tokens.subList(remainder + 1, tokens.size()) : List.of();

        ArithmeticPayload.ArithmeticPayloadBuilder builder = ArithmeticPayload.builder().operation(kind);
        List<String> leftValues = operandValues(left);
        List<String> rightValues = operandValues(right);
        List<String> results = new ArrayList<>();

        for (String value : leftValues) {
            if (CobolText.isIdentifier(value)) {
                builder.operand(value);
            }
        }
        if (!givingPart.isEmpty()) {
            for (String value : rightValues) {
                if (CobolText.isIdentifier(value)) {
                    builder.operand(value);
                }
            }
            results.addAll(operandValues(givingPart));
        } else {
            results.addAll(rightValues);
        }
        results.addAll(operandValues(remainderPart));
        results.removeIf(r -> !CobolText.isIdentifier(r));
        builder.results(results);
        builder.rounded(rest.contains("ROUNDED"));

        String resultName = results.isEmpty() ? "?" : results.get(0);
        String leftExpr = String.join(" " + symbol(kind) + " ", leftValues);
        String rightExpr = rightValues.isEmpty() ? "" : rightValues.get(0);
        String formula = switch (kind) {
            case ADD -> givingPart.isEmpty()
                    ? resultName + " = " + resultName + " + " + leftExpr
                    : resultName + " = " + join(leftValues, rightValues, " + ");
            case SUBTRACT -> resultName + " = " + (givingPart.isEmpty() ? resultName : rightExpr)
                    + " - " + String.join(" - ", leftValues);
            case MULTIPLY -> resultName + " = " + leftExpr + " * " + (rightExpr.isEmpty() ? resultName : rightExpr);
            default -> "INTO".equals(separator)
                    ? resultName + " = " + (givingPart.isEmpty() ? resultName : rightExpr) + " / " + leftExpr
                    : resultName + " = " + leftExpr + " / " + rightExpr;
        };
        return builder.formula(formula).build();
    }

    private ConditionPayload condition(List<String> rest, String subject) {
        int actionStart = rest.size();
        for (int i = 0; i < rest.size(); i++) {
            StatementKind embedded = StatementKind.fromVerb(rest.get(i));
            if (embedded != null && embedded != StatementKind.OTHER && i > 0) {
                actionStart = i;
                break;
            }
        }
        List<String> predicate = new ArrayList<>(rest.subList(0, actionStart));
        if (!predicate.isEmpty() && predicate.get(predicate.size() - 1).equals("THEN")) {
            predicate.remove(predicate.size() - 1);
        }

        ConditionPayload.ConditionPayloadBuilder builder = ConditionPayload.builder().subject(subject);
        List<String> current = new ArrayList<>();
        boolean sawOr = false;
        boolean sawAnd = false;
        for (String token : predicate) {
            if (token.equals("AND") || token.equals("OR")) {
                sawOr |= token.equals("OR");
                sawAnd |= token.equals("AND");
                if (!current.isEmpty()) {
                    builder.condition(String.join(" ", current));
                    current.clear();
                }
            } else {
                current.add(token);
            }
        }
        if (!current.isEmpty()) {
            builder.condition(String.join(" ", current));
        }

        if (sawOr) {
            builder.operator(LogicalOperator.OR);
        } else if (!sawAnd && !predicate.isEmpty() && predicate.get(0).equals("NOT")) {
            builder.operator(LogicalOperator.NOT);
        } else {
            builder.operator(LogicalOperator.AND);
        }
        if (actionStart < rest.size()) {
            builder.truthPath(String.join(" ", rest.subList(actionStart, rest.size())));
        }
        return builder.build();
    }

    private PerformPayload perform(List<String> rest) {
        PerformPayload.PerformPayloadBuilder builder = PerformPayload.builder();
        if (rest.isEmpty()) {
            return builder.inline(true).build();
        }
        String first = rest.get(0);
        boolean firstIsCount = rest.size() > 1 && rest.get(1).equals("TIMES");
        boolean inline = !CobolText.isIdentifier(first) || firstIsCount;
        if (!inline) {
            builder.target(first);
        }
        builder.inline(inline);

        int thru = indexOfAny(rest, "THRU", "THROUGH");
        if (thru >= 0 && thru + 1 < rest.size()) {
            builder.thruTarget(rest.get(thru + 1));
        }
        int times = rest.indexOf("TIMES");
        if (times > 0) {
            builder.times(rest.get(times - 1));
        }
        int until = rest.indexOf("UNTIL");
        int varying = rest.indexOf("VARYING");
        if (until >= 0) {
            builder.until(String.join(" ", rest.subList(until + 1, rest.size())));
        }
        if (varying >= 0) {
            int end = until > varying ? until : rest.size();
            builder.varying(String.join(" ", rest.subList(varying + 1, end)));
        }
        return builder.build();
    }

    private GoToPayload goTo(List<String> rest) {
        GoToPayload.GoToPayloadBuilder builder = GoToPayload.builder();
        int depending = rest.indexOf("DEPENDING");
        List<String> targets = depending >= 0 ? rest.subList(0, depending) : rest;
        for (String target : targets) {
            if (!target.equals("TO") && CobolText.isIdentifier(target)) {
                builder.target(target);
            }
        }
        if (depending >= 0) {
            for (String token : rest.subList(depending + 1, rest.size())) {
                if (CobolText.isIdentifier(CobolText.baseName(token))) {
                    builder.dependingOn(CobolText.baseName(token));
                    break;
                }
            }
        }
        return builder.build();
    }

    private CallPayload call(List<String> rest) {
        String rawTarget = rest.isEmpty() ? "" : rest.get(0);
        boolean dynamic = !CobolText.isQuoted(rawTarget);
        CallPayload.CallPayloadBuilder builder = CallPayload.builder()
                .target(dynamic ? rawTarget : CobolText.unquote(rawTarget).toUpperCase())
                .dynamic(dynamic);

        int using = rest.indexOf("USING");
        if (using >= 0) {
            for (String token : truncate(rest.subList(using + 1, rest.size()), CALL_STOP)) {
                String name = CobolText.baseName(token);
                if (CobolText.isIdentifier(name)) {
                    builder.argument(name);
                }
            }
        }
        int giving = indexOfAny(rest, "RETURNING", "GIVING");
        if (giving >= 0 && giving + 1 < rest.size()) {
            builder.giving(CobolText.baseName(rest.get(giving + 1)));
        }
        return builder.build();
    }

    private FileIoPayload fileIo(StatementKind kind, List<String> rest) {
        FileIoPayload.FileIoPayloadBuilder builder = FileIoPayload.builder().operation(kind);
        List<String> tokens = truncate(rest, FILE_IO_STOP);

        if (kind == StatementKind.OPEN) {
            String mode = "INPUT";
            for (String token : tokens) {
                if (OPEN_MODES.contains(token)) {
                    mode = token;
                } else if (CobolText.isIdentifier(token)) {
                    builder.fileName(token).openMode(mode);
                }
            }
            return builder.build();
        }
        if (kind == StatementKind.CLOSE) {
            for (String token : tokens) {
                if (CobolText.isIdentifier(token)) {
                    builder.fileName(token);
                }
            }
            return builder.build();
        }

        String name = tokens.isEmpty() ? null : CobolText.baseName(tokens.get(0));
        if (kind == StatementKind.WRITE || kind == StatementKind.REWRITE) {
            builder.recordName(name);
        } else if (name != null) {
            builder.fileName(name);
        }
        int into = tokens.indexOf("INTO");
        if (into >= 0 && into + 1 < tokens.size()) {
            builder.intoField(CobolText.baseName(tokens.get(into + 1)));
        }
        int from = tokens.indexOf("FROM");
        if (from >= 0 && from + 1 < tokens.size()) {
            builder.fromField(CobolText.baseName(tokens.get(from + 1)));
        }
        int key = tokens.indexOf("KEY");
        if (key >= 0) {
            for (String token : tokens.subList(key + 1, tokens.size())) {
                if (CobolText.isIdentifier(CobolText.baseName(token))) {
                    builder.keyField(CobolText.baseName(token));
                    break;
                }
            }
        }
        return builder.build();
    }

    private StringPayload stringPayload(List<String> rest) {
        StringPayload.StringPayloadBuilder builder = StringPayload.builder();
        int into = rest.indexOf("INTO");
        List<String> sources = into >= 0 ? rest.subList(0, into) : rest;
        String delimiter = null;
        for (int i = 0; i < sources.size(); i++) {
            String token = sources.get(i);
            if (token.equals("DELIMITED")) {
                int by = i + 1 < sources.size() && sources.get(i + 1).equals("BY") ? i + 2 : i + 1;
                if (by < sources.size()) {
                    if (delimiter == null) {
                        delimiter = sources.get(by);
                    }
                    i = by;
                }
            } else if (CobolText.isIdentifier(CobolText.baseName(token))) {
                builder.source(CobolText.baseName(token));
            }
        }
        builder.delimiter(delimiter);
        if (into >= 0 && into + 1 < rest.size()) {
            builder.target(CobolText.baseName(rest.get(into + 1)));
        }
        int pointer = rest.indexOf("POINTER");
        if (pointer >= 0 && pointer + 1 < rest.size()) {
            builder.pointer(CobolText.baseName(rest.get(pointer + 1)));
        }
        return builder.build();
    }

    private UnstringPayload unstringPayload(List<String> rest) {
        UnstringPayload.UnstringPayloadBuilder builder = UnstringPayload.builder();
        if (!rest.isEmpty()) {
            builder.source(CobolText.baseName(rest.get(0)));
        }
        int by = rest.indexOf("BY");
        if (by >= 0 && by + 1 < rest.size()) {
            String delimiter = rest.get(by + 1);
            if (delimiter.equals("ALL") && by + 2 < rest.size()) {
                delimiter = "ALL " + rest.get(by + 2);
            }
            builder.delimiter(delimiter);
        }
        int into = rest.indexOf("INTO");
        if (into >= 0) {
            List<String> targets = truncate(rest.subList(into + 1, rest.size()), Set.of("WITH", "TALLYING", "ON", "NOT"));
            for (int i = 0; i < targets.size(); i++) {
                String token = targets.get(i);
                if (token.equals("DELIMITER") || token.equals("COUNT")) {
                    // DELIMITER IN x / COUNT IN y belong to the preceding receiving field
                    i += i + 1 < targets.size() && targets.get(i + 1).equals("IN") ? 2 : 1;
                } else if (CobolText.isIdentifier(CobolText.baseName(token))) {
                    builder.target(CobolText.baseName(token));
                }
            }
        }
        return builder.build();
    }

    private InspectPayload inspect(List<String> rest) {
        InspectPayload.InspectPayloadBuilder builder = InspectPayload.builder();
        if (!rest.isEmpty()) {
            builder.target(CobolText.baseName(rest.get(0)));
        }
        int tallying = rest.indexOf("TALLYING");
        int replacing = rest.indexOf("REPLACING");
        int converting = rest.indexOf("CONVERTING");
        if (tallying >= 0) {
            builder.mode(InspectPayload.Mode.TALLYING);
            if (tallying + 1 < rest.size()) {
                builder.tallyingField(CobolText.baseName(rest.get(tallying + 1)));
            }
        } else if (replacing >= 0) {
            builder.mode(InspectPayload.Mode.REPLACING);
        } else if (converting >= 0) {
            builder.mode(InspectPayload.Mode.CONVERTING);
        }
        return builder.build();
    }

    private ExecPayload exec(List<String> rest, String restText) {
        String language = rest.isEmpty() ? "UNKNOWN" : rest.get(0);
        String body = cutAt(restText.length() > language.length() ? restText.substring(language.length()) : "",
                "END-EXEC").trim();
        ExecPayload.ExecPayloadBuilder builder = ExecPayload.builder().language(language).body(body);

        Set<String> tables = new LinkedHashSet<>();
        Matcher tableMatcher = SQL_TABLE.matcher(CobolText.stripLiterals(body));
        while (tableMatcher.find()) {
            tables.add(tableMatcher.group(1));
        }
        Set<String> hostVariables = new LinkedHashSet<>();
        Matcher hostMatcher = HOST_VARIABLE.matcher(CobolText.stripLiterals(body));
        while (hostMatcher.find()) {
            hostVariables.add(hostMatcher.group(1));
        }
        // INTO :HOST-VAR is not a table
        tables.removeIf(t -> t.startsWith(":"));
        return builder.tables(new ArrayList<>(tables)).hostVariables(new ArrayList<>(hostVariables)).build();
    }

    private static String stripSentencePeriod(String text) {
        String t = text;
        if (t.endsWith(".") && !CobolText.hasOpenLiteral(t.substring(0, t.length() - 1))) {
            t = t.substring(0, t.length() - 1).trim();
        }
        return t;
    }

    /**
     * Drop sentence terminators from every token.
     */
    private static List<String> clean(List<String> tokens) {
        List<String> result = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            String t = CobolText.stripTerminator(token);
            if (!t.isEmpty()) {
                result.add(t);
            }
        }
        return result;
    }

    /**
     * Operands with their OF/IN qualifiers removed.
     */
    private static List<String> unqualified(List<String> operands) {
        List<String> result = new ArrayList<>();
        for (int i = 0; i < operands.size(); i++) {
            String token = operands.get(i);
            if (token.equals("OF") || token.equals("IN")) {
                i++;
            } else {
                result.add(token);
            }
        }
        return result;
    }

    private static List<String> operandValues(List<String> tokens) {
        List<String> result = new ArrayList<>();
        for (String token : unqualified(tokens)) {
            if (token.equals("ROUNDED")) {
                continue;
            }
            if (CobolText.isLiteral(token)) {
                result.add(token);
            } else if (CobolText.isIdentifier(CobolText.baseName(token))) {
                result.add(CobolText.baseName(token));
            }
        }
        return result;
    }

    private static List<String> truncate(List<String> tokens, Set<String> stopWords) {
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (stopWords.contains(token) || token.startsWith("END-")) {
                return tokens.subList(0, i);
            }
        }
        return tokens;
    }

    private static int indexOfAny(List<String> tokens, String... words) {
        for (int i = 0; i < tokens.size(); i++) {
            for (String word : words) {
                if (tokens.get(i).equals(word)) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static String cutAt(String text, String... markers) {
        int cut = text.length();
        for (String marker : markers) {
            int idx = CobolText.indexOutsideLiterals(text, marker);
            if (idx >= 0 && idx < cut) {
                cut = idx;
            }
        }
        return text.substring(0, cut);
    }

    private static String join(List<String> first, List<String> second, String operator) {
        List<String> all = new ArrayList<>(first);
        all.addAll(second);
        return String.join(operator, all);
    }

    private static String symbol(StatementKind kind) {
        return switch (kind) {
            case ADD -> "+";
            case SUBTRACT -> "-";
            case MULTIPLY -> "*";
            default -> "/";
        };
    }
}
