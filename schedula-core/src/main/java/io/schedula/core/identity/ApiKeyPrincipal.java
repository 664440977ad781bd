package io.schedula.core.identity;

public record ApiKeyPrincipal(String key, String title) implements Principal {
    public ApiKeyPrincipal {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        title = title == null || title.isBlank() ? key : title.trim();
    }

    @Override
    public String sourceLabel() {
        return "API Key (" + title + ")";
    }

    @Override
    public String ownerField() {
        return "api_key";
    }

    @Override
    public String ownerValue() {
        return key;
    }
}
