// file: server/src/main/java/io/branchtree/server/dto/VariablesRequest.java
package io.branchtree.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON body for POST /conversations/{slug}/variables.
 * Example:
 *   { "action": "merge", "data": { "hp": 10 } }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class VariablesRequest {
    public String action; // get | set | merge | reset
    public JsonNode data; // required object for set/merge
}
