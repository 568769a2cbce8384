package com.taildeck.backend.modules.upstream.presentation.dto;

import java.util.List;

import com.taildeck.backend.modules.upstream.application.UpdateNodeCommand;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record UpdateNodeRequest(
        @Size(min = 1, max = 253) String givenName,
        List<@Pattern(regexp = "^tag:.+", message = "must start with tag:") String> tags,
        @Size(min = 1) String user
) {

    public UpdateNodeCommand toCommand() {
        return new UpdateNodeCommand(givenName, tags, user);
    }
}
