// file: server/src/main/java/io/branchtree/server/dto/BranchRequest.java
package io.branchtree.server.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON body for POST /branches/{operation}. Each operation reads the fields
 * it needs; exactly one of {@code doc} / {@code file} names the document.
 * Example (append_message):
 *   {
 *     "file": "my-chat/conversation.json",
 *     "node_id": "u2",
 *     "pid": "a1",
 *     "role": "user",
 *     "content": "and then?",
 *     "return_mode": "node"
 *   }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BranchRequest {
    public JsonNode doc;
    public String file;

    @JsonProperty("node_id")
    public String nodeId;

    @JsonAlias("parent_id")
    public String pid;

    public String role;
    public String content;

    @JsonProperty("new_node_id")
    public String newNodeId;

    @JsonProperty("retry_node_id")
    public String retryNodeId;

    @JsonProperty("user_node_id")
    public String userNodeId;

    @JsonProperty("target_j")
    public Integer targetJ;

    @JsonProperty("return_mode")
    public String returnMode;
}
