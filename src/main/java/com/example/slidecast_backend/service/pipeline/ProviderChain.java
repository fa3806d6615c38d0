package com.example.slidecast_backend.service.pipeline;

import com.example.slidecast_backend.engine.Interfaces.NamedProvider;
import com.example.slidecast_backend.exception.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered fallback over interchangeable providers: the first one that returns wins.
 *
 * @param <T> provider type
 */
public final class ProviderChain<T extends NamedProvider> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProviderChain.class);

    @FunctionalInterface
    public interface Call<T, R> {
        R apply(T provider) throws Exception;
    }

    private final String purpose;
    private final List<T> providers;

    public ProviderChain(String purpose, List<T> providers) {
        if (providers == null || providers.isEmpty()) {
            throw new IllegalArgumentException("No providers configured for " + purpose);
        }
        this.purpose = purpose;
        this.providers = List.copyOf(providers);
    }

    /**
     * @throws ProviderException when every provider failed; each failure is attached as suppressed.
     */
    public <R> R call(String item, Call<T, R> call) {
        List<Exception> failures = new ArrayList<>();
        String lastProvider = null;
        for (T provider : providers) {
            try {
                return call.apply(provider);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderException(purpose + " interrupted for " + item, e);
            } catch (Exception e) {
                LOGGER.warn("PROVIDER failed purpose={} provider={} item={} err={}", purpose, provider.name(), item, e.toString());
                failures.add(e);
                lastProvider = provider.name();
            }
        }
        Exception last = failures.get(failures.size() - 1);
        ProviderException ex = new ProviderException("All " + purpose + " providers failed for " + item
                + " (last " + lastProvider + ": " + last.getMessage() + ")");
        failures.forEach(ex::addSuppressed);
        throw ex;
    }

    public String purpose() {
        return purpose;
    }
}
