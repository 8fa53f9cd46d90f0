package io.github.hongjungwan.contextlog.api.exception;

public class BuiltinContextNotFoundException extends ContextLogException {

    private final String contextName;

    public BuiltinContextNotFoundException(String contextName) {
        super(String.format("Builtin log context '%s' not found", contextName));
        this.contextName = contextName;
    }

    public String getContextName() {
        return contextName;
    }
}
