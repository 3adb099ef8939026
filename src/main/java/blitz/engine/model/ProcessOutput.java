package blitz.engine.model;

/**
 * One element of a supervised process's output stream. {@link Completed} and
 * {@link Failed} are terminal; exactly one of them ends every stream.
 */
public sealed interface ProcessOutput {

    default boolean isTerminal() {
        return false;
    }

    record Stdout(String line) implements ProcessOutput {
    }

    record Stderr(String line) implements ProcessOutput {
    }

    record Completed(int exitCode) implements ProcessOutput {
        public boolean isSuccess() {
            return exitCode == 0;
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record Failed(String message) implements ProcessOutput {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }
}
