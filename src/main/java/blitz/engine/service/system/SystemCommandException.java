package blitz.engine.service.system;

/**
 * An external command could not be started, or finished with a non-zero exit code.
 */
public class SystemCommandException extends Exception {

    public SystemCommandException(String message) {
        super(message);
    }

    public SystemCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
