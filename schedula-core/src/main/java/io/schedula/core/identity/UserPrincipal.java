package io.schedula.core.identity;

public record UserPrincipal(String username) implements Principal {
    public UserPrincipal {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username must not be blank");
        }
        username = username.trim();
    }

    @Override
    public String sourceLabel() {
        return "Manual (" + username + ")";
    }

    @Override
    public String ownerField() {
        return "username";
    }

    @Override
    public String ownerValue() {
        return username;
    }
}
