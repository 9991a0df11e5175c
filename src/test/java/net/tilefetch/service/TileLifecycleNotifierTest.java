package net.tilefetch.service;

import net.tilefetch.model.TileIdentity;
import net.tilefetch.service.event.TileRequestedEvent;
import net.tilefetch.service.event.TileRetrievedEvent;
import net.tilefetch.source.TileResultStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class TileLifecycleNotifierTest {

    private static final TileIdentity TILE = TileIdentity.of(2, 3, 5);

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private final List<Runnable> queued = new ArrayList<>();

    private TileLifecycleNotifier notifierWith(Executor executor) {
        return new TileLifecycleNotifier(eventPublisher, executor);
    }

    @Test
    void should_PublishOffTheCallingThread() {
        TileLifecycleNotifier notifier = notifierWith(queued::add);

        notifier.tileRequested(TILE, "osm");

        verifyNoInteractions(eventPublisher);
        assertThat(queued).hasSize(1);

        queued.get(0).run();

        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue()).isInstanceOfSatisfying(TileRequestedEvent.class, requested -> {
            assertThat(requested.getTileKey()).isEqualTo(TILE.key());
            assertThat(requested.getSourceKey()).isEqualTo("osm");
        });
    }

    @Test
    void should_CarryResultStatus_OnRetrievedEvent() {
        TileLifecycleNotifier notifier = notifierWith(Runnable::run);

        notifier.tileRetrieved(TILE, "osm", TileResultStatus.FETCHED);

        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue()).isInstanceOfSatisfying(TileRetrievedEvent.class, retrieved -> {
            assertThat(retrieved.getTile()).isEqualTo(TILE);
            assertThat(retrieved.getStatus()).isEqualTo(TileResultStatus.FETCHED);
        });
    }

    @Test
    void should_DropEventQuietly_When_ExecutorSaturated() {
        TileLifecycleNotifier notifier = notifierWith(task -> {
            throw new RejectedExecutionException("queue full");
        });

        assertThatCode(() -> notifier.tileRequested(TILE, "osm")).doesNotThrowAnyException();
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void should_ContainListenerFailures() {
        doThrow(new IllegalStateException("listener broke")).when(eventPublisher).publishEvent(any(Object.class));
        TileLifecycleNotifier notifier = notifierWith(Runnable::run);

        assertThatCode(() -> notifier.tileRetrieved(TILE, "osm", TileResultStatus.ABSENT)).doesNotThrowAnyException();
    }
}
