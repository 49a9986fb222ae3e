package io.github.drompincen.eligibility.runtime.clarify;

import java.util.regex.Pattern;

/**
 * Shapes of clarifying questions the filter recognises, plus concrete-date detection for raw
 * conversation text. Bump {@link #VERSION} on any change.
 */
public final class ClarifyPatterns {

    public static final String VERSION = "3";

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    /** Asks about policy the assistant should answer itself. */
    public static final Pattern POLICY_QUESTION = Pattern.compile(
            "\\b(waiting period|wait(ing)? time|deferral (length|period|time)|how long(?! ago)|polic(y|ies)"
                    + "|guidelines?)\\b", FLAGS);

    public static final Pattern DATE_ASK = Pattern.compile(
            "\\b(when|what date|which date|the date|how long ago|what day|which day|date of)\\b", FLAGS);

    public static final Pattern CONFIRM_TYPE_ASK = Pattern.compile(
            "\\b(confirm|which|what)\\b.*\\b(type|name|brand|kind) of (vaccin\\w*|shot|jab)\\b"
                    + "|\\bconfirm\\b.*\\b(vaccin\\w*|shot|jab)\\b"
                    + "|\\b(which|what) (vaccin\\w*|shot|jab)\\b", FLAGS);

    public static final Pattern OTHER_VACCINATIONS_ASK = Pattern.compile(
            "\\b(other|any (additional|more|further)) (vaccin\\w*|shots?|jabs?|immuni[sz]ations?)\\b", FLAGS);

    public static final Pattern LAST_DONATION_ASK = Pattern.compile(
            "\\b(last|previous|most recent|prior) (blood )?donation\\b|\\b(last|previously) donated?\\b"
                    + "|\\bdonated (blood )?before\\b|\\bwhen did you (last )?(donate|give blood)\\b", FLAGS);

    public static final Pattern GENERIC_CONDITIONS_ASK = Pattern.compile(
            "\\b(any|other) (medical|health) (conditions?|issues?|problems?|concerns?)\\b"
                    + "|\\bmedical history\\b|\\bhealth conditions?\\b", FLAGS);

    private static final String MONTH = "(jan(uary)?|feb(ruary)?|mar(ch)?|apr(il)?|may|june?|july?|aug(ust)?"
            + "|sep(t(ember)?)?|oct(ober)?|nov(ember)?|dec(ember)?)";

    /** A calendar date written out in full: ISO, numeric, or with a month name and day. */
    public static final Pattern CONCRETE_DATE = Pattern.compile(
            "\\b\\d{4}-\\d{1,2}-\\d{1,2}\\b"
                    + "|\\b\\d{1,2}/\\d{1,2}/\\d{2,4}\\b"
                    + "|\\b" + MONTH + "\\.? \\d{1,2}(st|nd|rd|th)?(,? \\d{4})?\\b"
                    + "|\\b\\d{1,2}(st|nd|rd|th)? (of )?" + MONTH + "\\b", FLAGS);

    private ClarifyPatterns() {}

    public static boolean isPolicyQuestion(String candidate) {
        return POLICY_QUESTION.matcher(candidate).find();
    }

    public static boolean isDateAsk(String candidate) {
        return DATE_ASK.matcher(candidate).find();
    }

    public static boolean isConfirmTypeAsk(String candidate) {
        return CONFIRM_TYPE_ASK.matcher(candidate).find();
    }

    public static boolean isOtherVaccinationsAsk(String candidate) {
        return OTHER_VACCINATIONS_ASK.matcher(candidate).find();
    }

    public static boolean isLastDonationAsk(String candidate) {
        return LAST_DONATION_ASK.matcher(candidate).find();
    }

    public static boolean isGenericConditionsAsk(String candidate) {
        return GENERIC_CONDITIONS_ASK.matcher(candidate).find();
    }

    public static boolean containsConcreteDate(String text) {
        return text != null && CONCRETE_DATE.matcher(text).find();
    }
}
