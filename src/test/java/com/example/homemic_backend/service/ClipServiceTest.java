package com.example.homemic_backend.service;

import com.example.homemic_backend.dto.BulkDeleteResponse;
import com.example.homemic_backend.exception.NotFoundException;
import com.example.homemic_backend.exception.StorageFailureException;
import com.example.homemic_backend.model.Clip;
import com.example.homemic_backend.model.Node;
import com.example.homemic_backend.service.Interfaces.AudioStorage;
import com.example.homemic_backend.service.Interfaces.ClipStore;
import com.example.homemic_backend.service.events.ClipReceivedEvent;
import com.example.homemic_backend.util.ExportFormat;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClipServiceTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private ClipStore store;
    @Mock
    private AudioStorage storage;
    @Mock
    private ApplicationEventPublisher publisher;

    private ClipService service;

    @BeforeEach
    void setUp() {
        service = new ClipService(store, storage, new TranscriptExporter(new ObjectMapper().findAndRegisterModules()), publisher,
                Clock.fixed(T0, ZoneOffset.UTC));
    }

    @Test
    void recentLooksBackFromNow() {
        when(store.recentTranscribed(T0.minusSeconds(600), ClipService.MAX_LIMIT)).thenReturn(List.of());

        assertThat(service.recent(10)).isEmpty();
        verify(store).recentTranscribed(T0.minusSeconds(600), ClipService.MAX_LIMIT);
    }

    @Test
    void recentWindowIsBounded() {
        assertThatThrownBy(() -> service.recent(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.recent(61)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(store);
    }

    @Test
    void historyRejectsBadPaging() {
        assertThatThrownBy(() -> service.history(null, null, null, null, null, 0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.history(null, null, null, null, null, 0, ClipService.MAX_LIMIT + 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.history(null, null, null, null, null, -1, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.history(null, null, T0, T0.minusSeconds(1), null, 0, 10)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(store);
    }

    @Test
    void bulkDeleteDropsDuplicatesAndSurvivesBlobFailures() {
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        when(store.delete(any())).thenReturn(List.of(
                new ClipStore.DeletedClip(a, "kitchen", "kitchen/a.wav"),
                new ClipStore.DeletedClip(b, "kitchen", "kitchen/b.wav")));
        doThrow(new StorageFailureException("busy")).when(storage).delete("kitchen/a.wav");

        BulkDeleteResponse response = service.bulkDelete(List.of(a, b, a));

        assertThat(response.deleted()).isEqualTo(2);
        assertThat(response.filesRemoved()).isEqualTo(1);
        verify(storage).delete("kitchen/b.wav");
    }

    @Test
    void deleteCanKeepAudio() {
        Clip clip = clip();
        when(store.require(clip.getId())).thenReturn(clip);
        when(store.delete(List.of(clip.getId())))
                .thenReturn(List.of(new ClipStore.DeletedClip(clip.getId(), "kitchen", clip.getObjectKey())));

        service.delete(clip.getId(), false);

        verify(storage, never()).delete(any());
    }

    @Test
    void audioIsGoneAfterRetention() {
        Clip clip = clip();
        clip.setAudioDeleted(true);
        when(store.require(clip.getId())).thenReturn(clip);

        assertThatThrownBy(() -> service.audio(clip.getId())).isInstanceOf(NotFoundException.class);
        verifyNoInteractions(storage);
    }

    @Test
    void retryRequeuesAndWakesTheWorker() {
        Clip clip = clip();
        when(store.retry(clip.getId())).thenReturn(clip);

        service.retry(clip.getId());

        verify(publisher).publishEvent(new ClipReceivedEvent(clip.getId(), "kitchen"));
    }

    @Test
    void bulkExportKeepsRequestOrderAndSkipsUnknownIds() {
        Clip first = clip();
        Clip second = clip();
        UUID missing = UUID.randomUUID();
        List<UUID> ids = List.of(second.getId(), missing, first.getId());
        when(store.segments(ids)).thenReturn(List.of());
        when(store.find(second.getId())).thenReturn(Optional.of(second));
        when(store.find(missing)).thenReturn(Optional.empty());
        when(store.find(first.getId())).thenReturn(Optional.of(first));

        TranscriptExporter.ExportDocument doc = service.bulkExport(ids, ExportFormat.TXT);

        assertThat(doc.body().indexOf(second.getId().toString())).isGreaterThanOrEqualTo(0).isLessThan(doc.body().indexOf(first.getId().toString()));
        assertThat(doc.body()).doesNotContain(missing.toString());
    }

    private static Clip clip() {
        UUID id = UUID.randomUUID();
        return new Clip(id, Node.register("kitchen"), id + ".wav", "kitchen/" + id + ".wav", 10, 2.0, T0, T0);
    }
}
