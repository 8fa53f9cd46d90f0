package io.github.hongjungwan.contextlog.api.exception;

public class BuiltinContextAmbiguousException extends ContextLogException {

    private final String contextName;
    private final int candidateCount;

    public BuiltinContextAmbiguousException(String contextName, int candidateCount) {
        super(String.format("Multiple builtin log contexts (%d) registered under '%s'",
                candidateCount, contextName));
        this.contextName = contextName;
        this.candidateCount = candidateCount;
    }

    public String getContextName() {
        return contextName;
    }

    public int getCandidateCount() {
        return candidateCount;
    }
}
