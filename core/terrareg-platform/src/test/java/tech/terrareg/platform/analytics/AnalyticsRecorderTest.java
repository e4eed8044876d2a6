package tech.terrareg.platform.analytics;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AnalyticsRecorder")
class AnalyticsRecorderTest {

    @Mock
    private AnalyticsEventRepository analyticsEventRepository;

    private AnalyticsRecorder recorder;

    @BeforeEach
    void setUp() {
        recorder = new AnalyticsRecorder();
        recorder.analyticsEventRepository = analyticsEventRepository;
    }

    @AfterEach
    void tearDown() {
        recorder.stop();
    }

    private static AnalyticsEvent event(long moduleVersionId) {
        AnalyticsEvent event = new AnalyticsEvent();
        event.moduleVersionId = moduleVersionId;
        event.analyticsToken = "ci-pipeline";
        return event;
    }

    @Test
    @DisplayName("drainPending writes queued events and assigns ids")
    void drainPending_shouldWriteQueuedEvents() {
        // Arrange
        AnalyticsEvent first = event(1L);
        AnalyticsEvent second = event(2L);
        recorder.record(first);
        recorder.record(second);

        // Act
        int written = recorder.drainPending();

        // Assert
        assertThat(written).isEqualTo(2);
        assertThat(first.id).isNotNull();
        assertThat(second.id).isNotNull().isNotEqualTo(first.id);
        assertThat(recorder.pendingCount()).isZero();
        verify(analyticsEventRepository, times(2)).persist(any());
    }

    @Test
    @DisplayName("a failing write is logged and the rest of the batch is still written")
    void drainPending_shouldContinue_whenOneWriteFails() {
        // Arrange
        AnalyticsEvent broken = event(1L);
        lenient().doThrow(new IllegalStateException("write concern error")).when(analyticsEventRepository).persist(broken);
        recorder.record(broken);
        recorder.record(event(2L));

        // Act
        int written = recorder.drainPending();

        // Assert
        assertThat(written).isEqualTo(1);
        verify(analyticsEventRepository, times(2)).persist(any());
    }

    @Test
    @DisplayName("events beyond the queue capacity are dropped and counted")
    void record_shouldDrop_whenQueueFull() {
        // Arrange
        for (int i = 0; i < AnalyticsRecorder.QUEUE_CAPACITY; i++) {
            assertThat(recorder.record(event(i))).isTrue();
        }

        // Act
        boolean accepted = recorder.record(event(-1L));

        // Assert
        assertThat(accepted).isFalse();
        assertThat(recorder.droppedCount()).isEqualTo(1);
        assertThat(recorder.pendingCount()).isEqualTo(AnalyticsRecorder.QUEUE_CAPACITY);
        verifyNoInteractions(analyticsEventRepository);
    }

    @Test
    @DisplayName("the worker writes events in the background once started")
    void start_shouldWriteEventsInBackground() {
        // Arrange
        recorder.start();

        // Act
        recorder.record(event(7L));

        // Assert
        verify(analyticsEventRepository, timeout(5000)).persist(argThat(e -> e.moduleVersionId == 7L));
    }

    @Test
    @DisplayName("stop flushes events still in the queue")
    void stop_shouldFlushPendingEvents() {
        // Arrange
        recorder.record(event(3L));
        recorder.record(event(4L));
        recorder.start();

        // Act
        recorder.stop();

        // Assert
        verify(analyticsEventRepository, times(2)).persist(any());
        assertThat(recorder.pendingCount()).isZero();
    }
}
