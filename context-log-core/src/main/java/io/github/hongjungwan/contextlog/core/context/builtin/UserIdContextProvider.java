package io.github.hongjungwan.contextlog.core.context.builtin;

import io.github.hongjungwan.contextlog.api.context.ContextRequest;
import io.github.hongjungwan.contextlog.api.context.LogContextProvider;

/**
 * Authenticated user, as left in the {@code user_id} request attribute by an upstream
 * authentication step. Never synthesized: unauthenticated requests log as {@code anonymous}.
 */
public class UserIdContextProvider extends LogContextProvider<String> {

    public static final String NAME = "user_id";
    public static final String ANONYMOUS = "anonymous";

    public UserIdContextProvider() {
        super(NAME, ANONYMOUS);
    }

    @Override
    public String extract(ContextRequest request) {
        return request.attribute(NAME)
                .map(String::valueOf)
                .filter(s -> !s.isBlank())
                .orElse(getDefaultValue());
    }
}
