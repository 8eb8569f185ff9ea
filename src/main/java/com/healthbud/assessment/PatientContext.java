package com.healthbud.assessment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class PatientContext {
    @JsonProperty("age") public final Integer age;
    @JsonProperty("biological_sex") public final String biologicalSex;
    @JsonProperty("chronic_conditions") public final List<String> chronicConditions;
    @JsonProperty("current_medications") public final List<String> currentMedications;
    @JsonProperty("allergies") public final List<String> allergies;

    @JsonCreator
    public PatientContext(
            @JsonProperty("age") Integer age,
            @JsonProperty("biological_sex") String biologicalSex,
            @JsonProperty("chronic_conditions") List<String> chronicConditions,
            @JsonProperty("current_medications") List<String> currentMedications,
            @JsonProperty("allergies") List<String> allergies) {
        this.age = age;
        this.biologicalSex = biologicalSex;
        this.chronicConditions = Lists.copyOrEmpty(chronicConditions);
        this.currentMedications = Lists.copyOrEmpty(currentMedications);
        this.allergies = Lists.copyOrEmpty(allergies);
    }
}
