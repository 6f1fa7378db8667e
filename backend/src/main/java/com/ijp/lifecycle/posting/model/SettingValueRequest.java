package com.ijp.lifecycle.posting.model;

import com.fasterxml.jackson.databind.JsonNode;

public record SettingValueRequest(JsonNode value) {
}
