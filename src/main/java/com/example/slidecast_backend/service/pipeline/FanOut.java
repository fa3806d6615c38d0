package com.example.slidecast_backend.service.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Runs an operation per item, collecting successes and failures instead of stopping at the first error.
 */
public final class FanOut {
    private static final Logger LOGGER = LoggerFactory.getLogger(FanOut.class);

    @FunctionalInterface
    public interface ItemCall<I, R> {
        R apply(I item) throws Exception;
    }

    private FanOut() {}

    public static <I, R> FanOutResult<R> run(String label, List<I> items, Function<I, String> itemName, ItemCall<I, R> call) {
        List<R> successes = new ArrayList<>();
        List<FanOutResult.Failure> failures = new ArrayList<>();
        for (I item : items) {
            String name = itemName.apply(item);
            try {
                successes.add(call.apply(item));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failures.add(new FanOutResult.Failure(name, "interrupted"));
                break;
            } catch (Exception e) {
                LOGGER.warn("FANOUT item failed label={} item={} err={}", label, name, e.toString());
                failures.add(new FanOutResult.Failure(name, e.getMessage()));
            }
        }
        FanOutResult<R> result = new FanOutResult<>(label, items.size(), successes, failures);
        if (!failures.isEmpty()) {
            LOGGER.info("FANOUT partial label={} ok={} failed={}", label, successes.size(), failures.size());
        }
        return result;
    }
}
