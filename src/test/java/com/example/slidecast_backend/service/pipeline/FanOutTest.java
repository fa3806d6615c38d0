package com.example.slidecast_backend.service.pipeline;

import com.example.slidecast_backend.exception.FanOutFailedException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FanOutTest {

    @Test
    void partialFailureKeepsSuccesses() {
        FanOutResult<Integer> result = FanOut.run("square", List.of(1, 2, 3, 4), i -> "item " + i, i -> {
            if (i % 2 == 0) {
                throw new IllegalStateException("even");
            }
            return i * i;
        });

        assertThat(result.allFailed()).isFalse();
        assertThat(result.successesOrThrow()).containsExactly(1, 9);
        assertThat(result.failures()).extracting(FanOutResult.Failure::item).containsExactly("item 2", "item 4");
    }

    @Test
    void totalFailureThrows() {
        FanOutResult<Integer> result = FanOut.run("square", List.of(1, 2), i -> "item " + i, i -> {
            throw new IllegalStateException("nope");
        });

        assertThatThrownBy(result::successesOrThrow)
                .isInstanceOf(FanOutFailedException.class)
                .hasMessageContaining("all 2 items");
    }

    @Test
    void noItemsIsNotAFailure() {
        FanOutResult<Integer> result = FanOut.run("square", List.<Integer>of(), i -> "item " + i, i -> i);

        assertThat(result.successesOrThrow()).isEmpty();
    }
}
