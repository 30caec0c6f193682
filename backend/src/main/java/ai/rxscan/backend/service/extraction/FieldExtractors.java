package ai.rxscan.backend.service.extraction;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Cascades for the scalar prescription fields.
 *
 * <p>Patterns are listed in priority order. Captures never cross a line break, so a label
 * on one line cannot pull in the value of the next.
 */
public final class FieldExtractors {

    private static final int CI = Pattern.CASE_INSENSITIVE;
    private static final int CI_LINES = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE;

    private static final String EMAIL = "[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}";
    private static final String PHONE_VALUE = "(\\+?[\\d \\t\\-()]{10,15})";
    private static final String DECIMAL = "(\\d+(?:\\.\\d+)?)";
    private static final String DMY_DATE = "(\\d{1,2}[-/]\\d{1,2}[-/](?:\\d{4}|\\d{2}))(?!\\d)";
    private static final String YMD_DATE = "(\\d{4}[-/]\\d{1,2}[-/]\\d{1,2})(?!\\d)";
    private static final String EXPIRY_LABEL =
            "\\b(?:expir[ye]s?|expiry date|valid(?: till| until| upto)?|until)[ \\t]*[:\\-]?[ \\t]*";

    // A person's name stops at the end of the line, at punctuation or digits, or before another label.
    private static final String PERSON_NAME =
            "([A-Za-z][A-Za-z .]{1,49}?)(?=[ \\t]*(?:$|[,;|\\d]|\\b(?:age|dob|sex|gender|mobile|phone|email)\\b))";

    private static final String CLINIC_WORD =
            "(?:clinic|hospital|nursing home|medical cent(?:er|re)|health cent(?:er|re))";

    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-()]");
    private static final Pattern DATE_SEPARATOR = Pattern.compile("[-/]");
    private static final Pattern DOCTOR_PREFIX = Pattern.compile("^(?:dr|doctor|md|mbbs)\\b\\.?\\s*", CI);

    private static final int MIN_PHONE_DIGITS = 10;

    public static final FieldCascade PATIENT_EMAIL = FieldCascade.named("patientEmail")
            .then(Pattern.compile("\\b" + EMAIL + "\\b"), group(0))
            .build();

    public static final FieldCascade PATIENT_MOBILE = FieldCascade.named("patientMobile")
            .then(Pattern.compile("\\b(?:phone|mobile|mob|contact|ph)\\b\\.?[ \\t]*(?:no\\.?|number)?[ \\t]*[:\\-]?[ \\t]*"
                    + PHONE_VALUE, CI), phoneNumber(1))
            .then(Pattern.compile("(?<!\\d)(?:\\+?91[ \\-]?)?[6-9]\\d{9}(?!\\d)"), phoneNumber(0))
            .then(Pattern.compile("(?<!\\d)(?:\\+1[ \\-]?)?\\(?\\d{3}\\)?[ \\-]?\\d{3}[ \\-]?\\d{4}(?!\\d)"), phoneNumber(0))
            .then(Pattern.compile("\\+?\\d[\\d \\t\\-()]{9,14}"), phoneNumber(0))
            .build();

    public static final FieldCascade AGE = FieldCascade.named("age")
            .then(Pattern.compile("\\bage[ \\t]*:?[ \\t]*(\\d+)[ \\t]*(?:years?|yrs?|y\\b)", CI), boundedNumber(1, 0, 150))
            .then(Pattern.compile("(?<!\\d)(\\d+)[ \\t]*(?:years?|yrs?|y\\b)(?:[ \\t]*old)?", CI), boundedNumber(1, 0, 150))
            .then(Pattern.compile("\\bage[ \\t]*[:\\-][ \\t]*(\\d+)", CI), boundedNumber(1, 0, 150))
            .then(Pattern.compile("(?<!\\d)(\\d+)[ \\t]*y\\.?o\\.?", CI), boundedNumber(1, 0, 150))
            .build();

    public static final FieldCascade WEIGHT = FieldCascade.named("weight")
            .then(Pattern.compile("\\bweight[ \\t]*:?[ \\t]*" + DECIMAL + "[ \\t]*(?:kgs?|kilograms?)\\b", CI),
                    boundedNumber(1, 0, 500))
            .then(Pattern.compile("\\bwt\\.?[ \\t]*:?[ \\t]*" + DECIMAL + "[ \\t]*kgs?\\b", CI), boundedNumber(1, 0, 500))
            .then(Pattern.compile(DECIMAL + "[ \\t]*(?:kgs?|kilograms?)\\b", CI), boundedNumber(1, 0, 500))
            .build();

    public static final FieldCascade HEIGHT = FieldCascade.named("height")
            .then(Pattern.compile("\\bheight[ \\t]*:?[ \\t]*" + DECIMAL + "[ \\t]*(?:cms?|centimet(?:er|re)s?)\\b", CI),
                    boundedNumber(1, 50, 300))
            .then(Pattern.compile("\\bht\\.?[ \\t]*:?[ \\t]*" + DECIMAL + "[ \\t]*cms?\\b", CI), boundedNumber(1, 50, 300))
            .then(Pattern.compile(DECIMAL + "[ \\t]*(?:cms?|centimet(?:er|re)s?)\\b", CI), boundedNumber(1, 50, 300))
            .then(Pattern.compile("(?<!\\d)(\\d{1,2})['’][ \\t]*(\\d{1,2})[\"”]"), feetAndInches(1, 2, 50, 300))
            .then(Pattern.compile("(?<!\\d)(\\d{1,2})[ \\t]*(?:feet|foot|ft)\\.?[ \\t]*(\\d{1,2})[ \\t]*(?:inches|inch|in)\\b", CI),
                    feetAndInches(1, 2, 50, 300))
            .build();

    public static final FieldCascade EXPIRES_AT = FieldCascade.named("expiresAt")
            .then(Pattern.compile(EXPIRY_LABEL + DMY_DATE, CI), dayMonthYear(1))
            .then(Pattern.compile(EXPIRY_LABEL + YMD_DATE, CI), yearMonthDay(1))
            .then(Pattern.compile("\\b(?:next visit|follow.?up)[ \\t]*(?:on|date)?[ \\t]*[:\\-]?[ \\t]*" + DMY_DATE, CI),
                    dayMonthYear(1))
            .build();

    public static final FieldCascade PATIENT_NAME = FieldCascade.named("patientName")
            .then(Pattern.compile("(?:\\bpatient(?:'s)?(?:[ \\t]+name)?|^[ \\t]*name)[ \\t]*[:\\-][ \\t]*" + PERSON_NAME,
                    CI_LINES), patientName(1))
            .then(Pattern.compile("\\b(?:mrs|mr|ms|miss)\\.?[ \\t]+" + PERSON_NAME, CI_LINES), patientName(1))
            .then(Pattern.compile("^[ \\t]*([A-Za-z][A-Za-z .]{1,49}?)[ \\t,]*\\b(?:age|dob)\\b", CI_LINES), patientName(1))
            .build();

    public static final FieldCascade DOCTOR_NAME = FieldCascade.named("doctorName")
            .then(Pattern.compile("\\b(?:dr|doctor)\\b\\.?(?:[ \\t]*name)?[ \\t]*[:\\-]?[ \\t]*" + PERSON_NAME, CI_LINES),
                    doctorName(1))
            .then(Pattern.compile("\\bprescribed by[ \\t]*:?[ \\t]*" + PERSON_NAME, CI_LINES), doctorName(1))
            .then(Pattern.compile("\\bphysician[ \\t]*:?[ \\t]*" + PERSON_NAME, CI_LINES), doctorName(1))
            .then(Pattern.compile("\\bconsultant[ \\t]*:?[ \\t]*" + PERSON_NAME, CI_LINES), doctorName(1))
            .build();

    public static final FieldCascade DOCTOR_EMAIL = FieldCascade.named("doctorEmail")
            .then(Pattern.compile("\\b(?:doctor|dr|physician|consultant)\\b[^\\n]*?(" + EMAIL + ")", CI), group(1))
            .build();

    public static final FieldCascade DOCTOR_MOBILE = FieldCascade.named("doctorMobile")
            .then(Pattern.compile("\\b(?:doctor|dr|physician|consultant)\\b[^\\n]*?\\b(?:phone|mobile|mob|contact|ph)\\b\\.?"
                    + "[ \\t]*(?:no\\.?)?[ \\t]*[:\\-]?[ \\t]*" + PHONE_VALUE, CI), phoneNumber(1))
            .build();

    public static final FieldCascade CLINIC_NAME = FieldCascade.named("clinicName")
            .then(Pattern.compile("\\b" + CLINIC_WORD + "(?:[ \\t]+name)?[ \\t]*:[ \\t]*([A-Za-z0-9][A-Za-z0-9 .&'-]{2,49})", CI),
                    longerThan(1, 5))
            .then(Pattern.compile("^[ \\t]*([A-Za-z][A-Za-z.&' ]{0,48}?[ \\t]" + CLINIC_WORD + ")\\b", CI_LINES),
                    longerThan(1, 5))
            .build();

    public static final FieldCascade CLINIC_ADDRESS = FieldCascade.named("clinicAddress")
            .then(Pattern.compile("\\b(?:address|location)[ \\t]*:?[ \\t]*([A-Za-z0-9][A-Za-z0-9 ,.#/-]{9,99})", CI),
                    longerThan(1, 5))
            .build();

    public static final FieldCascade INSTRUCTIONS = FieldCascade.named("instructions")
            .then(Pattern.compile("\\binstructions?[ \\t]*[:\\-][ \\t]*(.+)$", CI_LINES), longerThan(1, 10))
            .then(Pattern.compile("\\bnotes?[ \\t]*[:\\-][ \\t]*(.+)$", CI_LINES), longerThan(1, 10))
            .then(Pattern.compile("\\bdirections?[ \\t]*[:\\-][ \\t]*(.+)$", CI_LINES), longerThan(1, 10))
            .then(Pattern.compile("\\badvice[ \\t]*[:\\-][ \\t]*(.+)$", CI_LINES), longerThan(1, 10))
            .build();

    private FieldExtractors() {
    }

    static Function<MatchResult, Optional<String>> group(int group) {
        return match -> Optional.ofNullable(match.group(group))
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }

    static Function<MatchResult, Optional<String>> longerThan(int group, int minExclusive) {
        return match -> group(group).apply(match).filter(value -> value.length() > minExclusive);
    }

    /**
     * Accepts the captured number when it lies strictly between the bounds; returns it as written.
     */
    static Function<MatchResult, Optional<String>> boundedNumber(int group, double minExclusive, double maxExclusive) {
        return match -> group(group).apply(match)
                .filter(value -> isWithin(Double.parseDouble(value), minExclusive, maxExclusive));
    }

    /**
     * Converts a feet/inches pair to whole centimeters, then applies the bounds.
     */
    static Function<MatchResult, Optional<String>> feetAndInches(int feetGroup, int inchesGroup,
                                                                double minExclusive, double maxExclusive) {
        return match -> {
            long feet = Long.parseLong(match.group(feetGroup));
            long inches = match.group(inchesGroup) != null ? Long.parseLong(match.group(inchesGroup)) : 0;
            long centimeters = Math.round((feet * 12 + inches) * 2.54);
            return isWithin(centimeters, minExclusive, maxExclusive)
                    ? Optional.of(Long.toString(centimeters))
                    : Optional.empty();
        };
    }

    /**
     * Strips separators and requires at least ten digits.
     */
    static Function<MatchResult, Optional<String>> phoneNumber(int group) {
        return match -> {
            String number = SEPARATORS.matcher(match.group(group)).replaceAll("");
            long digits = number.chars().filter(Character::isDigit).count();
            return digits >= MIN_PHONE_DIGITS ? Optional.of(number) : Optional.empty();
        };
    }

    static Function<MatchResult, Optional<String>> dayMonthYear(int group) {
        return match -> {
            String[] parts = DATE_SEPARATOR.split(match.group(group));
            if (parts.length != 3) {
                return Optional.empty();
            }
            return Optional.of(isoDate(parts[2], parts[1], parts[0]));
        };
    }

    static Function<MatchResult, Optional<String>> yearMonthDay(int group) {
        return match -> {
            String[] parts = DATE_SEPARATOR.split(match.group(group));
            if (parts.length != 3) {
                return Optional.empty();
            }
            return Optional.of(isoDate(parts[0], parts[1], parts[2]));
        };
    }

    static Function<MatchResult, Optional<String>> patientName(int group) {
        return match -> group(group).apply(match)
                .filter(name -> name.length() > 2)
                .filter(name -> {
                    String lower = name.toLowerCase(Locale.ROOT);
                    return !lower.contains("patient") && !lower.contains("name");
                });
    }

    static Function<MatchResult, Optional<String>> doctorName(int group) {
        return match -> group(group).apply(match)
                .map(name -> DOCTOR_PREFIX.matcher(name).replaceFirst("").trim())
                .filter(name -> name.length() > 2)
                .filter(name -> !name.toLowerCase(Locale.ROOT).contains("name"));
    }

    private static String isoDate(String year, String month, String day) {
        String fullYear = year.length() == 2 ? "20" + year : year;
        return fullYear + "-" + padTwo(month) + "-" + padTwo(day);
    }

    private static String padTwo(String value) {
        return value.length() < 2 ? "0" + value : value;
    }

    private static boolean isWithin(double value, double minExclusive, double maxExclusive) {
        return value > minExclusive && value < maxExclusive;
    }
}
