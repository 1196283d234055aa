package io.storefront.toolkit.streams.hub;

import io.storefront.toolkit.core.time.ManualClock;
import io.storefront.toolkit.streams.channel.StreamChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class StreamHubTest {

    private ManualClock clock;
    private StreamHub hub;
    private List<StreamEvent> globalEvents;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        hub = new StreamHub(clock);
        globalEvents = new ArrayList<>();
        hub.global().subscribe(globalEvents::add);
    }

    @Test
    void createChannelShouldBeIdempotent() {
        StreamChannel<String> first = hub.createChannel("orders");
        StreamChannel<String> second = hub.createChannel("orders");

        assertThat(first).isSameAs(second);
        assertThat(hub.channelCount()).isEqualTo(1);
        assertThat(hub.channelNames()).containsExactly("orders");
    }

    @Test
    void emitShouldReachChannelAndGlobalEnvelope() {
        StreamChannel<String> orders = hub.createChannel("orders");
        List<String> received = new ArrayList<>();
        orders.subscribe(received::add);

        boolean delivered = hub.emit("orders", "order-1");

        assertThat(delivered).isTrue();
        assertThat(received).containsExactly("order-1");
        assertThat(globalEvents).hasSize(1);
        StreamEvent event = globalEvents.get(0);
        assertThat(event.type()).isEqualTo("orders");
        assertThat(event.payload()).isEqualTo("order-1");
        assertThat(event.source()).isEqualTo(StreamEvent.SOURCE_STREAM);
        assertThat(event.timestamp()).isEqualTo(clock.instant());
        assertThat(event.id()).isNotBlank();
    }

    @Test
    void emitOnUnknownChannelIsDropped() {
        assertThat(hub.emit("missing", "value")).isFalse();
        assertThat(globalEvents).isEmpty();
    }

    @Test
    void channelErrorShouldBeRebroadcastAsErrorEvent() {
        StreamChannel<String> payments = hub.createChannel("payments");
        IllegalStateException failure = new IllegalStateException("gateway down");

        payments.error(failure);

        assertThat(globalEvents).hasSize(1);
        StreamEvent event = globalEvents.get(0);
        assertThat(event.type()).isEqualTo(StreamEvent.ERROR_TYPE);
        assertThat(event.isError()).isTrue();
        StreamError error = (StreamError) event.payload();
        assertThat(error.stream()).isEqualTo("payments");
        assertThat(error.error()).isSameAs(failure);
    }

    @Test
    void completeShouldCloseAndRemoveChannel() {
        StreamChannel<String> orders = hub.createChannel("orders");

        hub.complete("orders");

        assertThat(orders.isCompleted()).isTrue();
        assertThat(hub.channel("orders")).isEmpty();
        assertThat(hub.<String>createChannel("orders")).isNotSameAs(orders);
    }

    @Test
    void namedEventsShouldReachListenersAndGlobal() {
        List<Object> listened = new ArrayList<>();
        hub.onEvent("cart.updated").subscribe(listened::add);

        hub.emitEvent("cart.updated", "cart-7");

        assertThat(listened).containsExactly("cart-7");
        assertThat(globalEvents).singleElement()
            .satisfies(event -> {
                assertThat(event.type()).isEqualTo("cart.updated");
                assertThat(event.source()).isEqualTo(StreamEvent.SOURCE_EVENT);
            });
    }

    @Test
    void closeShouldCompleteEverything() {
        StreamChannel<String> orders = hub.createChannel("orders");

        hub.close();

        assertThat(orders.isCompleted()).isTrue();
        assertThat(hub.global().isCompleted()).isTrue();
        assertThat(hub.channelCount()).isZero();
    }

    @Test
    void globalSubscriberRelayingIntoChannelShouldNotBlockConcurrentEmits() throws Exception {
        hub.createChannel("orders");
        StreamChannel<String> audit = hub.createChannel("audit");
        AtomicInteger audited = new AtomicInteger();
        audit.subscribe(entry -> audited.incrementAndGet());
        hub.global().subscribe(event -> {
            if ("orders".equals(event.type())) {
                hub.emit("audit", "placed:" + event.payload());
            }
        });

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> orders = executor.submit(() -> {
                for (int i = 0; i < 2_000; i++) {
                    hub.emit("orders", "order-" + i);
                }
            });
            Future<?> direct = executor.submit(() -> {
                for (int i = 0; i < 2_000; i++) {
                    hub.emit("audit", "manual-" + i);
                }
            });
            orders.get(10, TimeUnit.SECONDS);
            direct.get(10, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        await().atMost(Duration.ofSeconds(5)).until(() -> audited.get() == 4_000);
    }
}
