package com.guicedee.rabbitbus.resilience;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Classifies failures for retries and circuit breakers.
 * <p>
 * An ignored match always wins. With handled predicates present only their matches are accepted,
 * with none present everything else is.
 */
public final class ExceptionFilter
{
    private static final ExceptionFilter ALL = new ExceptionFilter(List.of(), List.of());

    private final List<Predicate<Throwable>> handled;
    private final List<Predicate<Throwable>> ignored;

    private ExceptionFilter(List<Predicate<Throwable>> handled, List<Predicate<Throwable>> ignored)
    {
        this.handled = List.copyOf(handled);
        this.ignored = List.copyOf(ignored);
    }

    public static ExceptionFilter all()
    {
        return ALL;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Matches the type and its subclasses
     */
    public static Predicate<Throwable> ofType(Class<? extends Throwable> type)
    {
        Objects.requireNonNull(type, "type");
        return type::isInstance;
    }

    public boolean matches(Throwable failure)
    {
        if (failure == null)
        {
            return false;
        }
        for (Predicate<Throwable> predicate : ignored)
        {
            if (predicate.test(failure))
            {
                return false;
            }
        }
        if (handled.isEmpty())
        {
            return true;
        }
        for (Predicate<Throwable> predicate : handled)
        {
            if (predicate.test(failure))
            {
                return true;
            }
        }
        return false;
    }

    public boolean hasHandled()
    {
        return !handled.isEmpty();
    }

    public boolean hasIgnored()
    {
        return !ignored.isEmpty();
    }

    public static final class Builder
    {
        private final List<Predicate<Throwable>> handled = new ArrayList<>();
        private final List<Predicate<Throwable>> ignored = new ArrayList<>();

        private Builder()
        {
        }

        public Builder handle(Class<? extends Throwable> type)
        {
            handled.add(ofType(type));
            return this;
        }

        public Builder handle(Predicate<Throwable> predicate)
        {
            handled.add(Objects.requireNonNull(predicate, "predicate"));
            return this;
        }

        public Builder ignore(Class<? extends Throwable> type)
        {
            ignored.add(ofType(type));
            return this;
        }

        public Builder ignore(Predicate<Throwable> predicate)
        {
            ignored.add(Objects.requireNonNull(predicate, "predicate"));
            return this;
        }

        public ExceptionFilter build()
        {
            if (handled.isEmpty() && ignored.isEmpty())
            {
                return ALL;
            }
            return new ExceptionFilter(handled, ignored);
        }
    }
}
