package io.github.drompincen.eligibility.runtime.clarify;

import io.github.drompincen.eligibility.protocol.api.Topic;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword and explicit-negation tables per topic. Bump {@link #VERSION} whenever a pattern
 * changes so logged filter decisions can be traced to the table that produced them.
 */
public final class TopicPatterns {

    public static final String VERSION = "3";

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final String VACCINE_NOUN = "(vaccin\\w*|shots?|jabs?|immuni[sz]ations?|boosters?)";
    private static final String NO_ANY = "(no|not any|none|haven't had any|have not had any|hadn't any"
            + "|didn't (get|have|receive) any|did not (get|have|receive) any|never had any|without any)";

    private static final Map<Topic, Pattern> MENTIONS;
    private static final Map<Topic, Pattern> NEGATIONS;

    private static final Pattern OTHER_VACCINES_DENIED = Pattern.compile(
            "\\b" + NO_ANY + " other " + VACCINE_NOUN + "\\b"
                    + "|\\bno (additional|more|further) " + VACCINE_NOUN + "\\b"
                    + "|\\bonly (had |got |received )?(the |that |this |one )" + VACCINE_NOUN + "\\b", FLAGS);

    static {
        Map<Topic, Pattern> mentions = new EnumMap<>(Topic.class);
        mentions.put(Topic.VACCINE, Pattern.compile(
                "\\b(vaccin\\w*|immuni[sz]\\w*|shots?|jabs?|boosters?|covid[- ]?19 shot|flu shot|mmr|hpv)\\b", FLAGS));
        mentions.put(Topic.TATTOO, Pattern.compile(
                "\\b(tattoo\\w*|piercings?|pierced|microblading|permanent make-?up|inked)\\b", FLAGS));
        mentions.put(Topic.TRAVEL, Pattern.compile(
                "\\b(travel\\w*|trips?|abroad|overseas|visited|flew|vacation|holiday|countr(y|ies)|destinations?|malaria)\\b",
                FLAGS));
        mentions.put(Topic.DONATION, Pattern.compile(
                "\\b((last|previous|prior|most recent) (blood )?donation|donated|gave blood|given blood"
                        + "|last time i (gave|donated))\\b", FLAGS));
        mentions.put(Topic.MEDICATION, Pattern.compile(
                "\\b(medications?|medicines?|meds|pills?|tablets?|antibiotics?|prescri\\w*|aspirin|ibuprofen"
                        + "|isotretinoin|accutane|finasteride|warfarin|blood thinners?|insulin)\\b", FLAGS));
        mentions.put(Topic.SYMPTOMS, Pattern.compile(
                "\\b(symptoms?|fever\\w*|cough\\w*|cold|flu(?!\\s*(shot|jab|vaccin))|sore throat|infections?|pain"
                        + "|headaches?|dizz\\w*|nausea\\w*|rash\\w*|sick|ill|illness|unwell|diarrh\\w*|vomit\\w*)\\b",
                FLAGS));
        MENTIONS = Collections.unmodifiableMap(mentions);

        Map<Topic, Pattern> negations = new EnumMap<>(Topic.class);
        negations.put(Topic.VACCINE, Pattern.compile(
                "\\b" + NO_ANY + " (recent )?" + VACCINE_NOUN + "\\b|\\bnot (been )?vaccinated\\b"
                        + "|\\bnever (been )?vaccinated\\b", FLAGS));
        negations.put(Topic.TATTOO, Pattern.compile(
                "\\b(no|don't have (a|any)|do not have (a|any)|never had (a|any)|never got (a|any)"
                        + "|haven't (had|got|gotten) (a|any)|have not (had|got|gotten) (a|any)|without (a|any))"
                        + " (new |recent )?(tattoos?|piercings?)\\b", FLAGS));
        negations.put(Topic.TRAVEL, Pattern.compile(
                "\\b(no (recent )?(travel\\w*|trips?)|(haven't|have not|didn't|did not|never) (travel\\w*|been abroad"
                        + "|left the country|gone abroad|been overseas)|not travel\\w*)\\b", FLAGS));
        negations.put(Topic.DONATION, Pattern.compile(
                "\\b(never (donated|given blood|gave blood)|first[- ]time (donor|donating)|haven't (ever )?donated"
                        + "|have not (ever )?donated)\\b", FLAGS));
        negations.put(Topic.MEDICATION, Pattern.compile(
                "\\b(no (medications?|medicines?|meds|pills|antibiotics)|not (taking|on) any (medications?|medicines?"
                        + "|meds|pills|antibiotics)|(don't|do not) take any (medications?|medicines?|meds|pills))\\b",
                FLAGS));
        negations.put(Topic.SYMPTOMS, Pattern.compile(
                "\\b(no symptoms?|no fever|(feel|feeling) (fine|well|healthy|good)|not sick|not ill"
                        + "|(haven't|have not) been (sick|ill)|symptom[- ]free)\\b", FLAGS));
        NEGATIONS = Collections.unmodifiableMap(negations);
    }

    private TopicPatterns() {}

    public static boolean mentions(String text, Topic topic) {
        return MENTIONS.get(topic).matcher(normalize(text)).find();
    }

    public static Set<Topic> mentioned(String text) {
        String normalized = normalize(text);
        Set<Topic> found = EnumSet.noneOf(Topic.class);
        MENTIONS.forEach((topic, pattern) -> {
            if (pattern.matcher(normalized).find()) found.add(topic);
        });
        return found;
    }

    public static boolean negates(String text, Topic topic) {
        return NEGATIONS.get(topic).matcher(normalize(text)).find();
    }

    public static Set<Topic> negated(String text) {
        String normalized = normalize(text);
        Set<Topic> found = EnumSet.noneOf(Topic.class);
        NEGATIONS.forEach((topic, pattern) -> {
            if (pattern.matcher(normalized).find()) found.add(topic);
        });
        return found;
    }

    public static boolean otherVaccinationsDenied(String text) {
        return OTHER_VACCINES_DENIED.matcher(normalize(text)).find();
    }

    static String normalize(String text) {
        if (text == null) return "";
        return text.replace('’', '\'').replace('‘', '\'');
    }
}
