package com.salesforce.streaming.delivery;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageAwaiterTest {

    @Test
    void shouldCompleteWithFirstMessage() throws Exception {
        MessageAwaiter<String> awaiter = new MessageAwaiter<>();

        awaiter.onMessage("first");
        awaiter.onMessage("second");

        assertThat(awaiter.isDone()).isTrue();
        assertThat(awaiter.await(Duration.ofMillis(10))).isEqualTo("first");
    }

    @Test
    void shouldSkipMessagesRejectedByFilter() throws Exception {
        MessageAwaiter<String> awaiter = new MessageAwaiter<>(message -> message.startsWith("My New Account"));

        awaiter.onMessage("Unrelated");
        assertThat(awaiter.isDone()).isFalse();

        awaiter.onMessage("My New Account #1");
        assertThat(awaiter.await(Duration.ofMillis(10))).isEqualTo("My New Account #1");
    }

    @Test
    void shouldTimeOutWhenNothingArrives() {
        MessageAwaiter<String> awaiter = new MessageAwaiter<>();

        assertThatThrownBy(() -> awaiter.await(Duration.ofMillis(50)))
                .isInstanceOf(TimeoutException.class);
    }

    @Test
    void shouldCompleteFromAnotherThread() throws Exception {
        MessageAwaiter<String> awaiter = new MessageAwaiter<>();

        new Thread(() -> awaiter.onMessage("async")).start();

        assertThat(awaiter.await(Duration.ofSeconds(5))).isEqualTo("async");
    }
}
