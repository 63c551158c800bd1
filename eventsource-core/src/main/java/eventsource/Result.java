package eventsource;

import eventsource.error.EventSourcingError;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a domain-level operation: either {@link Ok} with a value or {@link Err}
 * with an {@link EventSourcingError}.
 *
 * <p>Stores, the replay engine, both buses and the saga manager return results for
 * every expected failure (conflicts, missing handlers, upcast gaps). Infrastructure
 * failures are thrown instead.
 *
 * @param <T> the success value type
 */
public sealed interface Result<T> permits Result.Ok, Result.Err {

    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> err(EventSourcingError error) {
        return new Err<>(error);
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean isErr() {
        return this instanceof Err;
    }

    /**
     * Returns the error if this is an {@link Err}.
     */
    default Optional<EventSourcingError> failure() {
        if (this instanceof Err<T> err) {
            return Optional.of(err.error());
        }
        return Optional.empty();
    }

    default <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (this instanceof Ok<T> ok) {
            return new Ok<>(mapper.apply(ok.value()));
        }
        return new Err<>(((Err<T>) this).error());
    }

    default <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (this instanceof Ok<T> ok) {
            return Objects.requireNonNull(mapper.apply(ok.value()), "mapper result");
        }
        return new Err<>(((Err<T>) this).error());
    }

    default T orElse(T other) {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        return other;
    }

    /**
     * Returns the value, or throws {@link EventSourcingException} carrying the error.
     */
    default T orElseThrow() {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        throw new EventSourcingException(((Err<T>) this).error());
    }

    default Result<T> ifOk(Consumer<? super T> action) {
        if (this instanceof Ok<T> ok) {
            action.accept(ok.value());
        }
        return this;
    }

    default Result<T> ifErr(Consumer<? super EventSourcingError> action) {
        if (this instanceof Err<T> err) {
            action.accept(err.error());
        }
        return this;
    }

    /**
     * Successful outcome. {@code value} may be null for operations with nothing to return.
     */
    record Ok<T>(T value) implements Result<T> {
    }

    /**
     * Failed outcome.
     */
    record Err<T>(EventSourcingError error) implements Result<T> {
        public Err {
            Objects.requireNonNull(error, "error");
        }
    }
}
