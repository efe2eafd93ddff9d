// file: server/src/main/java/io/branchtree/server/dto/CreateConversationResponse.java
package io.branchtree.server.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON response for POST /conversations. root_node_id and nodes_count are
 * omitted for sandbox conversations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CreateConversationResponse {
    public boolean success;
    public String slug;
    public String file;

    @JsonProperty("settings_file")
    public String settingsFile;

    @JsonProperty("variables_file")
    public String variablesFile;

    public String name;
    public String type;

    @JsonProperty("updated_at")
    public String updatedAt;

    @JsonProperty("root_node_id")
    public String rootNodeId;

    @JsonProperty("nodes_count")
    public Integer nodesCount;
}
