// file: server/src/main/java/io/branchtree/server/dto/SettingsResponse.java
package io.branchtree.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public class SettingsResponse {
    public String slug;

    @JsonProperty("settings_file")
    public String settingsFile;

    public JsonNode settings;
}
