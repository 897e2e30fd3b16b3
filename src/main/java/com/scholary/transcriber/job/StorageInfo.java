package com.scholary.transcriber.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Where the archived exports of a completed job live. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StorageInfo(
    String bucket,
    @JsonProperty("json_key") String jsonKey,
    @JsonProperty("json_url") String jsonUrl,
    @JsonProperty("srt_key") String srtKey,
    @JsonProperty("srt_url") String srtUrl) {}
