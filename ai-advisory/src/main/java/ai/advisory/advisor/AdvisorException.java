package ai.advisory.advisor;

public class AdvisorException extends Exception {
    private final AdvisorErrorKind kind;

    public AdvisorException(AdvisorErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AdvisorException(AdvisorErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public AdvisorErrorKind kind() {
        return kind;
    }
}
