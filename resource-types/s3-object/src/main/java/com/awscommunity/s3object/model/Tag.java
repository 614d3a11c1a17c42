package com.awscommunity.s3object.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Tag(
        @JsonProperty("Key") String key,
        @JsonProperty("Value") String value
) {}
