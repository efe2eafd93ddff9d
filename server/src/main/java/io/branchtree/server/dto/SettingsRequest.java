// file: server/src/main/java/io/branchtree/server/dto/SettingsRequest.java
package io.branchtree.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON body for POST /conversations/{slug}/settings.
 * Example:
 *   { "action": "update", "patch": { "type": "sandbox", "world_books": ["wb/a.json"] } }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SettingsRequest {
    public String action; // get | update
    public JsonNode patch; // required object for update
}
