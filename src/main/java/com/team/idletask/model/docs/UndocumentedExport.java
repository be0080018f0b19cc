package com.team.idletask.model.docs;

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
public class UndocumentedExport {

    private String file;
    private String name;
    private String type;       // function, class, interface, type, const, ...
    private int line;

    @JsonProperty("isPublic")
    private boolean publicExport;
}
