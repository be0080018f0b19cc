package com.team.idletask.model.analysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeprecatedPackage {

    private String name;
    private String currentVersion;
    private String reason;           // may be empty
    private String replacement;      // null when there is no known substitute
}
