package com.fintech.ticks.symbol;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SignalChannel Tests")
class SignalChannelTest {

    @Test
    @DisplayName("Delivers values in send order without dropping")
    void testFifoDelivery() throws InterruptedException {
        SignalChannel channel = new SignalChannel("AAPL/candlestick");
        for (long i = 0; i < 1_000; i++) {
            channel.send(i);
        }

        assertThat(channel.pending()).isEqualTo(1_000);
        for (long i = 0; i < 1_000; i++) {
            assertThat(channel.receive()).hasValue(i);
        }
        assertThat(channel.pending()).isZero();
    }

    @Test
    @DisplayName("Close drains pending values, then reports end of stream")
    void testCloseAfterDrain() throws InterruptedException {
        SignalChannel channel = new SignalChannel("AAPL/mean");
        channel.send(60_000L);
        channel.close();

        assertThat(channel.isClosed()).isTrue();
        assertThat(channel.receive()).hasValue(60_000L);
        assertThat(channel.receive()).isEmpty();
        assertThat(channel.receive()).isEmpty();
    }

    @Test
    @DisplayName("Send after close is rejected")
    void testSendAfterClose() {
        SignalChannel channel = new SignalChannel("MSFT/mean");
        channel.close();

        assertThatThrownBy(() -> channel.send(1L))
            .isInstanceOf(SignalChannelClosedException.class)
            .hasMessageContaining("MSFT/mean");
    }

    @Test
    @DisplayName("Close wakes a blocked receiver")
    void testCloseWakesReceiver() throws Exception {
        SignalChannel channel = new SignalChannel("AAPL/candlestick");
        CompletableFuture<OptionalLong> received = CompletableFuture.supplyAsync(() -> {
            try {
                return channel.receive();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });

        channel.close();

        assertThat(received.get(5, TimeUnit.SECONDS)).isEmpty();
    }
}
