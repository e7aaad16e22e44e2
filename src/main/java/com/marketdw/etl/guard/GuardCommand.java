package com.marketdw.etl.guard;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * The work wrapped by the guard. One call is one attempt.
 */
@FunctionalInterface
public interface GuardCommand {

    /**
     * @throws TimeoutException when the attempt ran past {@code timeout}; the command must already be stopped.
     *                          {@link TimeoutException#getMessage()} carries whatever output was captured.
     */
    CommandResult run(Duration timeout) throws IOException, InterruptedException, TimeoutException;
}
