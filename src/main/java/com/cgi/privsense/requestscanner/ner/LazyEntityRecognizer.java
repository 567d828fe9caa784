package com.cgi.privsense.requestscanner.ner;

import com.cgi.privsense.requestscanner.api.EntityRecognizer;
import com.cgi.privsense.requestscanner.exception.RecognizerInitializationException;
import com.cgi.privsense.requestscanner.model.EntitySpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Supplier;

/**
 * Initialize-once handle around an expensive recognizer.
 * The delegate is created on first use and kept for the process lifetime.
 * A failed initialization is remembered and rethrown, never retried.
 */
public class LazyEntityRecognizer implements EntityRecognizer {
    private static final Logger log = LoggerFactory.getLogger(LazyEntityRecognizer.class);

    private final Supplier<? extends EntityRecognizer> factory;
    private final Object lock = new Object();

    private volatile EntityRecognizer delegate;
    private volatile RecognizerInitializationException failure;

    public LazyEntityRecognizer(Supplier<? extends EntityRecognizer> factory) {
        this.factory = factory;
    }

    @Override
    public List<EntitySpan> recognize(String text) {
        return initialize().recognize(text);
    }

    /**
     * Returns the delegate, creating it on the first call.
     *
     * @return Initialized recognizer
     * @throws RecognizerInitializationException if the recognizer could not be created
     */
    public EntityRecognizer initialize() {
        EntityRecognizer current = delegate;
        if (current != null) {
            return current;
        }

        synchronized (lock) {
            if (delegate != null) {
                return delegate;
            }
            if (failure != null) {
                throw failure;
            }

            log.info("Initializing entity recognizer");
            try {
                EntityRecognizer created = factory.get();
                if (created == null) {
                    throw new RecognizerInitializationException("Entity recognizer factory returned null");
                }
                delegate = created;
                return created;
            } catch (RecognizerInitializationException e) {
                failure = e;
                log.error("Entity recognizer initialization failed: {}", e.getMessage(), e);
                throw e;
            } catch (RuntimeException e) {
                failure = new RecognizerInitializationException("Entity recognizer initialization failed", e);
                log.error("Entity recognizer initialization failed: {}", e.getMessage(), e);
                throw failure;
            }
        }
    }

    public boolean isInitialized() {
        return delegate != null;
    }
}
