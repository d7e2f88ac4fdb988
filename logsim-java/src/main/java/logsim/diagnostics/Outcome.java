package logsim.diagnostics;

public sealed interface Outcome<T> permits Outcome.Success, Outcome.Failure {

    record Success<T>(T value) implements Outcome<T> {}

    record Failure<T>(Diagnostic diagnostic) implements Outcome<T> {}

    static <T> Outcome<T> success(T value) { return new Success<>(value); }

    static <T> Outcome<T> failure(Diagnostic diagnostic) { return new Failure<>(diagnostic); }

    default boolean succeeded() { return this instanceof Success<?>; }
}
