package com.healthbud.assessment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rewrites third-person references to the person being assessed into second person.
 * Fixed lookup table, applied longest phrase first.
 */
public class SecondPersonRewriter {

    private static final Map<String, String> PHRASES = new LinkedHashMap<>();

    static {
        String[][] subjects = {
            {"The user", "the user"},
            {"This user", "this user"},
            {"The patient", "the patient"},
            {"This patient", "this patient"},
            {"User", "user"},
            {"Patient", "patient"},
        };
        String[][] verbs = {
            {"is", "are"},
            {"has", "have"},
            {"was", "were"},
            {"reports", "report"},
            {"describes", "describe"},
            {"feels", "feel"},
            {"should", "should"},
        };
        for (String[] subject : subjects) {
            for (String[] verb : verbs) {
                PHRASES.put(subject[0] + " " + verb[0], "You " + verb[1]);
                PHRASES.put(subject[1] + " " + verb[0], "you " + verb[1]);
            }
        }
        PHRASES.put("The user's", "Your");
        PHRASES.put("the user's", "your");
        PHRASES.put("The patient's", "Your");
        PHRASES.put("the patient's", "your");
        PHRASES.put("The user", "You");
        PHRASES.put("the user", "you");
        PHRASES.put("This user", "You");
        PHRASES.put("this user", "you");
        PHRASES.put("The patient", "You");
        PHRASES.put("the patient", "you");
    }

    private final List<Replacement> replacements = new ArrayList<>();

    public SecondPersonRewriter() {
        for (Map.Entry<String, String> entry : PHRASES.entrySet()) {
            replacements.add(new Replacement(
                Pattern.compile("\\b" + Pattern.quote(entry.getKey()) + "\\b"),
                Matcher.quoteReplacement(entry.getValue())));
        }
    }

    public String rewrite(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String rewritten = text;
        for (Replacement replacement : replacements) {
            rewritten = replacement.pattern.matcher(rewritten).replaceAll(replacement.value);
        }
        return rewritten;
    }

    public List<String> rewriteAll(List<String> values) {
        return values.stream().map(this::rewrite).collect(Collectors.toList());
    }

    /**
     * Applies {@link #rewrite} to every scalar and list text field.
     */
    public TriageAssessment rewrite(TriageAssessment assessment) {
        return assessment.toBuilder()
            .assistantMessage(rewrite(assessment.assistantMessage))
            .summary(rewrite(assessment.summary))
            .urgencyReason(rewrite(assessment.urgencyReason))
            .seekCareWithin(rewrite(assessment.seekCareWithin))
            .safetyDisclaimer(rewrite(assessment.safetyDisclaimer))
            .followUpQuestions(rewriteAll(assessment.followUpQuestions))
            .possibleConditions(rewriteAll(assessment.possibleConditions))
            .possibleRemedies(rewriteAll(assessment.possibleRemedies))
            .redFlags(rewriteAll(assessment.redFlags))
            .specialistTypes(rewriteAll(assessment.specialistTypes))
            .build();
    }

    private static final class Replacement {
        private final Pattern pattern;
        private final String value;

        private Replacement(Pattern pattern, String value) {
            this.pattern = pattern;
            this.value = value;
        }
    }
}
