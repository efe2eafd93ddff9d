// file: server/src/main/java/io/branchtree/server/dto/VariablesResponse.java
package io.branchtree.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public class VariablesResponse {
    public String slug;

    @JsonProperty("variables_file")
    public String variablesFile;

    public JsonNode variables;
}
