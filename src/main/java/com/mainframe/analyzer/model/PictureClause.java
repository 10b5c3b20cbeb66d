package com.mainframe.analyzer.model;

import lombok.Builder;
import lombok.Value;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Represents a parsed COBOL PIC (PICTURE) clause.
 */
@Value
@Builder
public class PictureClause {
    String rawPicture;
    String expandedPicture;
    boolean valid;
    boolean signed;
    boolean numeric;
    boolean alphanumeric;
    int integerDigits;
    int decimalDigits;
    int displayLength;
    boolean hasDecimalPoint;
    boolean hasImpliedDecimal;
    String editMask;

    /**
     * Largest item length accepted when expanding repeat counts; anything longer is treated as a
     * malformed picture.
     */
    public static final int MAX_ITEM_LENGTH = 16_777_215;

    private static final Pattern REPEAT_PATTERN = Pattern.compile("([A-Z9*+\\-$,./0])\\((\\d+)\\)");
    private static final Pattern VALID_PATTERN = Pattern.compile("^[SXAV9ZPBCRDE0/*+\\-.,$]+$");
    private static final Pattern EDIT_SYMBOLS = Pattern.compile("[Z*,.+\\-$B0/]|CR|DB");

    /**
     * Parse a raw COBOL PIC clause string. Returns null for a blank picture; an unparseable
     * picture yields an instance with {@code valid == false}.
     */
    public static PictureClause parse(String pic) {
        if (pic == null || pic.isBlank()) {
            return null;
        }

        String normalized = pic.toUpperCase().replaceAll("\\s+", "");
        if (normalized.endsWith(".")) {
            // a trailing period terminates the entry, it is not an insertion character
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        String expanded = expandPicture(normalized);
        if (expanded == null) {
            return PictureClause.builder()
                    .rawPicture(pic)
                    .expandedPicture(normalized)
                    .valid(false)
                    .build();
        }
        boolean valid = !expanded.isEmpty() && VALID_PATTERN.matcher(expanded).matches();

        boolean alphanumeric = expanded.contains("X") || expanded.contains("A");
        boolean numeric = !alphanumeric && (expanded.contains("9") || expanded.contains("Z"));
        boolean signed = expanded.startsWith("S");
        boolean hasImplied = expanded.contains("V");
        boolean hasExplicit = expanded.contains(".");

        int intDigits = 0;
        int decDigits = 0;

        if (numeric) {
            String withoutSign = expanded.replaceFirst("^S", "");
            int decimalPos = withoutSign.indexOf('V');
            if (decimalPos < 0) {
                decimalPos = withoutSign.indexOf('.');
            }

            if (decimalPos >= 0) {
                intDigits = countDigits(withoutSign.substring(0, decimalPos));
                decDigits = countDigits(withoutSign.substring(decimalPos + 1));
            } else {
                intDigits = countDigits(withoutSign);
            }
        }

        String editMask = null;
        if (valid && EDIT_SYMBOLS.matcher(expanded).find()) {
            editMask = normalized;
        }

        return PictureClause.builder()
                .rawPicture(pic)
                .expandedPicture(expanded)
                .valid(valid)
                .signed(signed)
                .numeric(numeric)
                .alphanumeric(alphanumeric)
                .integerDigits(intDigits)
                .decimalDigits(decDigits)
                .displayLength(valid ? displayLength(expanded) : 0)
                .hasDecimalPoint(hasExplicit)
                .hasImpliedDecimal(hasImplied)
                .editMask(editMask)
                .build();
    }

    /**
     * Expand repeat notation like X(10) to XXXXXXXXXX. Returns null when the expansion would exceed
     * {@link #MAX_ITEM_LENGTH}.
     */
    private static String expandPicture(String pic) {
        Matcher matcher = REPEAT_PATTERN.matcher(pic);
        StringBuilder sb = new StringBuilder();
        long total = 0;

        while (matcher.find()) {
            String digits = matcher.group(2);
            // more than nine digits cannot be a usable repeat count
            if (digits.length() > 9) {
                return null;
            }
            int count = Integer.parseInt(digits);
            total += count;
            if (total > MAX_ITEM_LENGTH) {
                return null;
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(matcher.group(1).repeat(count)));
        }
        matcher.appendTail(sb);

        return sb.toString();
    }

    private static int countDigits(String s) {
        return (int) s.chars().filter(c -> c == '9' || c == 'Z' || c == '*').count();
    }

    private static int displayLength(String expanded) {
        // S, V and P occupy no display positions
        return (int) expanded.chars().filter(c -> c != 'S' && c != 'V' && c != 'P').count();
    }

    /**
     * Infer the storage category for this picture combined with a usage.
     *
     * A signed picture stays SIGNED_NUMERIC whatever its usage; otherwise a binary or packed
     * usage wins over the picture's display category.
     */
    public DataType inferDataType(UsageType usage) {
        if (!valid || alphanumeric || !numeric) {
            return DataType.ALPHANUMERIC;
        }
        if (signed) {
            return DataType.SIGNED_NUMERIC;
        }
        if (usage != null) {
            switch (usage) {
                case PACKED_DECIMAL:
                    return DataType.COMP_3;
                case COMP:
                case COMP_5:
                    return DataType.COMP;
                case BINARY:
                    return DataType.BINARY;
                default:
                    break;
            }
        }
        if (hasImpliedDecimal || hasDecimalPoint) {
            return DataType.DECIMAL;
        }
        return DataType.NUMERIC;
    }

    /**
     * Calculate byte length for this picture and usage type.
     */
    public int getByteLength(UsageType usage) {
        if (!numeric) {
            return displayLength;
        }

        int digits = integerDigits + decimalDigits;
        return switch (usage) {
            case DISPLAY -> displayLength;
            case COMP, BINARY, COMP_5 -> digits <= 4 ? 2 : digits <= 9 ? 4 : 8;
            case PACKED_DECIMAL -> (digits / 2) + 1;
            case COMP_1, INDEX, POINTER -> 4;
            case COMP_2 -> 8;
        };
    }
}
