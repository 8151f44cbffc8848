package burst.error;

/**
 * A caller-supplied setup routine failed on one instance.
 */
public class SetupRoutineException extends BurstException {

    public SetupRoutineException(String message) {
        super(message);
    }

    public SetupRoutineException(String message, Throwable cause) {
        super(message, cause);
    }
}
