package com.ryuqq.statetree.core.event;

import com.ryuqq.statetree.core.exception.MalformedEntryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link ErrorObserver}: writes every failure to the SLF4J log.
 *
 * <p>Malformed collection records are logged at WARN, everything else at ERROR with the stack
 * trace.</p>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public final class LoggingErrorObserver implements ErrorObserver {

    private static final Logger log = LoggerFactory.getLogger(LoggingErrorObserver.class);

    @Override
    public void onError(ChangeEvent event, Throwable error) {
        if (error instanceof MalformedEntryException) {
            log.warn("Skipped malformed entry: {}", error.getMessage());
            return;
        }
        if (event == null) {
            log.error("State tree dispatch failure", error);
        } else {
            log.error("Listener for {} on {} failed", event.name(), event.target().path(), error);
        }
    }
}
