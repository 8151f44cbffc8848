package burst.ssh;

/**
 * Outcome of one remote command.
 *
 * @param exitStatus null when the server did not report one
 */
public record CommandResult(String stdout, String stderr, Integer exitStatus) {

    public boolean succeeded() {
        return exitStatus != null && exitStatus == 0;
    }
}
