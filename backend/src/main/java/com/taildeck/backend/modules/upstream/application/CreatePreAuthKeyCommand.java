package com.taildeck.backend.modules.upstream.application;

import java.util.List;

public record CreatePreAuthKeyCommand(String user, boolean reusable, boolean ephemeral, String expiration,
                                      List<String> aclTags) {
}
