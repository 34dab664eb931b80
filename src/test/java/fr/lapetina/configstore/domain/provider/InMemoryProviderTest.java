package fr.lapetina.configstore.domain.provider;

import fr.lapetina.configstore.domain.model.Item;
import fr.lapetina.configstore.domain.model.ItemList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryProviderTest {

    private InMemoryProvider provider;

    @BeforeEach
    void setUp() {
        provider = new InMemoryProvider("inmemory");
    }

    @Test
    @DisplayName("should start empty and never fail")
    void shouldStartEmpty() {
        ItemList list = provider.load();

        assertThat(list.isEmpty()).isTrue();
        assertThat(list.isFailed()).isFalse();
        assertThat(provider.name()).isEqualTo("inmemory");
    }

    @Test
    @DisplayName("should append items with chained calls")
    void shouldAppendWithChaining() {
        provider.add(Item.of("a", "1")).add(Item.of("b", "2"), Item.of("c", "3"));

        assertThat(provider.load().items())
                .extracting(Item::key)
                .containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("should return snapshots unaffected by later writes")
    void shouldReturnIsolatedSnapshots() {
        provider.add(Item.of("a", "1"));
        ItemList before = provider.load();

        provider.add(Item.of("b", "2"));
        provider.replace(List.of(Item.of("z", "26")));

        assertThat(before.items()).extracting(Item::key).containsExactly("a");
        assertThat(provider.load().items()).extracting(Item::key).containsExactly("z");
    }

    @Test
    @DisplayName("should never expose a half-replaced list")
    void shouldNeverExposeHalfReplacedList() throws InterruptedException {
        List<Item> even = List.of(Item.of("a", "0"), Item.of("b", "0"), Item.of("c", "0"));
        List<Item> odd = List.of(Item.of("a", "1"), Item.of("b", "1"), Item.of("c", "1"));
        provider.replace(even);

        AtomicBoolean torn = new AtomicBoolean(false);
        AtomicBoolean stop = new AtomicBoolean(false);
        CountDownLatch done = new CountDownLatch(4);
        ExecutorService executor = Executors.newFixedThreadPool(4);

        executor.submit(() -> {
            try {
                for (int i = 0; i < 5000; i++) {
                    provider.replace(i % 2 == 0 ? odd : even);
                }
            } finally {
                stop.set(true);
                done.countDown();
            }
        });
        for (int r = 0; r < 3; r++) {
            executor.submit(() -> {
                try {
                    while (!stop.get()) {
                        List<Item> snapshot = provider.load().items();
                        long distinct = snapshot.stream().map(Item::value).distinct().count();
                        if (snapshot.size() != 3 || distinct != 1) {
                            torn.set(true);
                        }
                    }
                } finally {
                    done.countDown();
                }
            });
        }

        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(torn).isFalse();
    }
}
