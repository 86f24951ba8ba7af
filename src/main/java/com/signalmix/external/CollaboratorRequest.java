package com.signalmix.external;

import java.util.List;

public record CollaboratorRequest(List<String> args) {
    public CollaboratorRequest {
        args = args == null ? List.of() : List.copyOf(args);
    }

    public static CollaboratorRequest of(String... args) {
        return new CollaboratorRequest(List.of(args));
    }

    public static CollaboratorRequest none() {
        return new CollaboratorRequest(List.of());
    }
}
