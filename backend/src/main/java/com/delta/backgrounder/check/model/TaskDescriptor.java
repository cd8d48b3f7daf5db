package com.delta.backgrounder.check.model;

import java.util.Objects;

/**
 * One independent unit of source work. {@code query} holds the task's single parameter:
 * a search string, a username, a profile URL or an image URL depending on the kind.
 * {@code provider} is only set for {@link TaskKind#PROFILE}.
 */
public record TaskDescriptor(
    String id,
    TaskKind kind,
    String query,
    ProfileProviderName provider
) {
    public TaskDescriptor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        if (kind == TaskKind.PROFILE && provider == null) {
            throw new IllegalArgumentException("profile task " + id + " needs a provider");
        }
    }

    public static TaskDescriptor of(String id, TaskKind kind, String query) {
        return new TaskDescriptor(id, kind, query, null);
    }

    public static TaskDescriptor profile(String id, ProfileProviderName provider, String knownUrl) {
        return new TaskDescriptor(id, TaskKind.PROFILE, knownUrl, provider);
    }
}
