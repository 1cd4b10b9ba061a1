package com.livebundle.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/sessions.
 *
 * @param templatePath directory to copy into the new workspace; nullable, defaults to the configured template
 */
public record CreateSessionRequest(
    @JsonProperty("templatePath") String templatePath
) {}
