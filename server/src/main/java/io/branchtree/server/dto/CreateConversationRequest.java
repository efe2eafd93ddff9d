// file: server/src/main/java/io/branchtree/server/dto/CreateConversationRequest.java
package io.branchtree.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * JSON body for POST /conversations.
 * Example:
 *   {
 *     "name": "My Chat",
 *     "description": "",
 *     "greetings": ["Hello!", "Hi there."],
 *     "type": "threaded"
 *   }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CreateConversationRequest {
    public String name;
    public String description;
    public List<String> greetings; // one root branch per entry
    public String type;            // "threaded" (default) or "sandbox"
}
