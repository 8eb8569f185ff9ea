package com.healthbud.assessment;

import com.healthbud.errors.SchemaValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Enforces the output contract on a normalized assessment.
 */
public class AssessmentValidator {

    public void validate(TriageAssessment assessment) throws SchemaValidationException {
        List<String> violations = new ArrayList<>();

        requireText(violations, "assistant_message", assessment.assistantMessage);
        requireText(violations, "summary", assessment.summary);
        requireText(violations, "urgency_reason", assessment.urgencyReason);
        requireText(violations, "seek_care_within", assessment.seekCareWithin);
        requireText(violations, "safety_disclaimer", assessment.safetyDisclaimer);
        if (assessment.urgencyLevel == null) {
            violations.add("urgency_level is required");
        }

        checkList(violations, "follow_up_questions", assessment.followUpQuestions);
        checkList(violations, "possible_conditions", assessment.possibleConditions);
        checkList(violations, "possible_remedies", assessment.possibleRemedies);
        checkList(violations, "red_flags", assessment.redFlags);
        checkList(violations, "specialist_types", assessment.specialistTypes);

        if (assessment.showStructuredOutput) {
            if (assessment.followUpQuestions.isEmpty()) {
                violations.add("follow_up_questions must not be empty on a structured turn");
            }
        } else {
            if (assessment.urgencyLevel != UrgencyLevel.LOW) {
                violations.add("urgency_level must be low when structured output is hidden");
            }
            if (!assessment.followUpQuestions.isEmpty() || !assessment.possibleConditions.isEmpty()
                || !assessment.possibleRemedies.isEmpty() || !assessment.redFlags.isEmpty()
                || !assessment.specialistTypes.isEmpty()) {
                violations.add("clinical lists must be empty when structured output is hidden");
            }
        }

        if (!violations.isEmpty()) {
            throw new SchemaValidationException(violations);
        }
    }

    private static void requireText(List<String> violations, String field, String value) {
        if (value == null || value.isBlank()) {
            violations.add(field + " is required");
        }
    }

    private static void checkList(List<String> violations, String field, List<String> values) {
        for (String value : values) {
            if (value == null || value.isBlank()) {
                violations.add(field + " contains a blank entry");
                return;
            }
        }
    }
}
