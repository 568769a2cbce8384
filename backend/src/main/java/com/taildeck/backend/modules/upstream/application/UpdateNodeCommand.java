package com.taildeck.backend.modules.upstream.application;

import java.util.List;

public record UpdateNodeCommand(String givenName, List<String> tags, String user) {
}
