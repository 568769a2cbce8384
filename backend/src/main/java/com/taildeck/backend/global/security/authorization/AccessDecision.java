package com.taildeck.backend.global.security.authorization;

import java.util.List;

public record AccessDecision(Outcome outcome, List<String> required, String requiredLevel) {

    public enum Outcome {
        ALLOW,
        UNAUTHENTICATED,
        FORBIDDEN
    }

    public static AccessDecision allow() {
        return new AccessDecision(Outcome.ALLOW, null, null);
    }

    public static AccessDecision unauthenticated() {
        return new AccessDecision(Outcome.UNAUTHENTICATED, null, null);
    }

    public static AccessDecision forbiddenAnyOf(List<String> required) {
        return new AccessDecision(Outcome.FORBIDDEN, List.copyOf(required), null);
    }

    public static AccessDecision forbiddenBelow(String requiredLevel) {
        return new AccessDecision(Outcome.FORBIDDEN, null, requiredLevel);
    }

    public boolean allowed() {
        return outcome == Outcome.ALLOW;
    }
}
