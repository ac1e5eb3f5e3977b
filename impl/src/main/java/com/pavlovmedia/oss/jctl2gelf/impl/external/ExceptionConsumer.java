package com.pavlovmedia.oss.jctl2gelf.impl.external;

import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * This is a class that is intended to be used with a Consumer<Exception> where
 * you want to keep going after a failure and deal with all of them at the end,
 * for instance when validating every field of a configuration document.
 * @author Shawn Dempsay {@literal <sdempsay@pavlovmedia.com>}
 * @since 1.0.0
 */
public class ExceptionConsumer {
    private final LinkedList<Exception> exceptions = new LinkedList<>();

    /**
     * This is the main method you would pass into a method that takes an
     * exception consumer
     * @since 1.0.0
     * @param e exception to handle
     */
    public void onError(final Exception e) {
        exceptions.add(e);
    }

    /**
     * Runs an action and collects anything it throws
     * @since 1.0.0
     */
    public void attempt(final Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            onError(e);
        }
    }

    /**
     * True if this consumer collected any exceptions
     * @since 1.0.0
     */
    public boolean hasErrors() {
        return !exceptions.isEmpty();
    }

    /**
     * Returns the full list of exceptions in the order they were collected
     * @since 1.0.0
     */
    public List<Exception> getExceptions() {
        return Collections.unmodifiableList(exceptions);
    }

    /**
     * This method will throw a converted throwable if there are any errors. The
     * converter gets every collected message joined with "; "
     * @since 1.0.0
     * @param exceptionConverter
     * @throws T
     */
    public <T extends Throwable> void andThrow(final Function<String,T> exceptionConverter) throws T {
        if (hasErrors()) {
            throw exceptionConverter.apply(exceptions.stream()
                    .map(Exception::getMessage)
                    .collect(Collectors.joining("; ")));
        }
    }
}
