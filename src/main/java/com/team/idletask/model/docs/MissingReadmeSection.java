package com.team.idletask.model.docs;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MissingReadmeSection {

    private String section;
    private SectionPriority priority;
    private String description;

    public enum SectionPriority {
        @JsonProperty("required") REQUIRED,
        @JsonProperty("recommended") RECOMMENDED,
        @JsonEnumDefaultValue
        @JsonProperty("optional") OPTIONAL
    }
}
