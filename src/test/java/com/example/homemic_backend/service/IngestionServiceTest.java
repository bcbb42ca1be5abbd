package com.example.homemic_backend.service;

import com.example.homemic_backend.config.IngestProperties;
import com.example.homemic_backend.exception.ClipTooLargeException;
import com.example.homemic_backend.exception.ClipValidationException;
import com.example.homemic_backend.exception.StorageFailureException;
import com.example.homemic_backend.model.Clip;
import com.example.homemic_backend.model.Node;
import com.example.homemic_backend.service.IngestionService.ClipUpload;
import com.example.homemic_backend.service.Interfaces.AudioStorage;
import com.example.homemic_backend.service.Interfaces.ClipStore;
import com.example.homemic_backend.service.events.ClipReceivedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.util.unit.DataSize;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private ClipStore store;
    @Mock
    private AudioStorage storage;
    @Mock
    private PrivacyGate gate;
    @Mock
    private NodeHealthMonitor health;
    @Mock
    private ApplicationEventPublisher publisher;

    private IngestionService service;

    @BeforeEach
    void setUp() {
        IngestProperties props = new IngestProperties();
        props.setMaxFileSize(DataSize.ofKilobytes(64));
        service = new IngestionService(store, storage, gate, health, publisher, props, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void admittedClipIsStoredThenAnnounced() {
        when(gate.check("kitchen", NOW)).thenReturn(PrivacyDecision.admit());
        when(store.create(any())).thenAnswer(inv -> toClip(inv.getArgument(0)));

        Clip clip = service.upload(new ClipUpload("kitchen", "a.wav", TestAudio.wav(1.5), null, null, "10.0.0.5"));

        ArgumentCaptor<ClipStore.NewClip> created = ArgumentCaptor.forClass(ClipStore.NewClip.class);
        verify(store).create(created.capture());
        assertThat(created.getValue().privacySuppressed()).isFalse();
        assertThat(created.getValue().durationSeconds()).isCloseTo(1.5, within(0.01));
        assertThat(created.getValue().objectKey()).startsWith("kitchen/2024-05-01/").endsWith("-a.wav");
        verify(storage).write(eq(created.getValue().objectKey()), any());
        verify(health).recordContact("kitchen", null, "10.0.0.5");
        verify(publisher).publishEvent(new ClipReceivedEvent(clip.getId(), "kitchen"));
    }

    @Test
    void mutedClipIsKeptAsSuppressedWithoutEvent() {
        Instant recordedAt = NOW.minusSeconds(60);
        when(gate.check("kitchen", recordedAt))
                .thenReturn(PrivacyDecision.reject(PrivacyDecision.Reason.NODE_MUTED, "until 11:00"));
        when(store.create(any())).thenAnswer(inv -> toClip(inv.getArgument(0)));

        service.upload(new ClipUpload("kitchen", "a.wav", new byte[]{1, 2, 3}, recordedAt, 3.0, null));

        ArgumentCaptor<ClipStore.NewClip> created = ArgumentCaptor.forClass(ClipStore.NewClip.class);
        verify(store).create(created.capture());
        assertThat(created.getValue().privacySuppressed()).isTrue();
        assertThat(created.getValue().recordedAt()).isEqualTo(recordedAt);
        verifyNoInteractions(publisher);
    }

    @Test
    void rejectsBadNodeIdBeforeTouchingAnything() {
        assertThatThrownBy(() -> service.upload(new ClipUpload("bad node!", "a.wav", new byte[]{1}, null, 1.0, null)))
                .isInstanceOf(ClipValidationException.class)
                .extracting("field").isEqualTo("node_id");
        verifyNoInteractions(store, storage, gate, health, publisher);
    }

    @Test
    void rejectsEmptyAudio() {
        assertThatThrownBy(() -> service.upload(new ClipUpload("kitchen", "a.wav", new byte[0], null, 1.0, null)))
                .isInstanceOf(ClipValidationException.class)
                .extracting("field").isEqualTo("audio");
    }

    @Test
    void rejectsOversizedAudio() {
        byte[] big = new byte[(int) DataSize.ofKilobytes(64).toBytes() + 1];

        assertThatThrownBy(() -> service.upload(new ClipUpload("kitchen", "a.wav", big, null, 1.0, null)))
                .isInstanceOf(ClipTooLargeException.class);
        verifyNoInteractions(storage, store);
    }

    @Test
    void rejectsNonPositiveDuration() {
        assertThatThrownBy(() -> service.upload(new ClipUpload("kitchen", "a.wav", new byte[]{1}, null, 0.0, null)))
                .isInstanceOf(ClipValidationException.class)
                .extracting("field").isEqualTo("duration_seconds");
    }

    @Test
    void requiresDurationWhenAudioIsNotWav() {
        assertThatThrownBy(() -> service.upload(new ClipUpload("kitchen", "a.mp3", new byte[100], null, null, null)))
                .isInstanceOf(ClipValidationException.class)
                .hasMessageContaining("non-WAV");
    }

    @Test
    void rowFailureRemovesTheBlob() {
        when(gate.check(anyString(), any())).thenReturn(PrivacyDecision.admit());
        when(store.create(any())).thenThrow(new IllegalStateException("db down"));

        assertThatThrownBy(() -> service.upload(new ClipUpload("kitchen", "a.wav", new byte[]{1}, null, 1.0, null)))
                .isInstanceOf(StorageFailureException.class)
                .hasCauseInstanceOf(IllegalStateException.class);

        ArgumentCaptor<String> key = ArgumentCaptor.forClass(String.class);
        verify(storage).write(key.capture(), any());
        verify(storage).delete(key.getValue());
        verifyNoInteractions(publisher);
    }

    @Test
    void sanitizeFilenameStripsPathsAndOddCharacters() {
        assertThat(IngestionService.sanitizeFilename("../../etc/pass wd.wav", NOW)).isEqualTo("pass_wd.wav");
        assertThat(IngestionService.sanitizeFilename("C:\\rec\\a.wav", NOW)).isEqualTo("a.wav");
        assertThat(IngestionService.sanitizeFilename("..", NOW)).isEqualTo("clip_" + NOW.getEpochSecond() + ".wav");
        assertThat(IngestionService.sanitizeFilename(null, NOW)).startsWith("clip_");
    }

    private static Clip toClip(ClipStore.NewClip c) {
        Clip clip = new Clip(c.id(), Node.register(c.nodeId()), c.filename(), c.objectKey(), c.fileSize(),
                c.durationSeconds(), c.recordedAt(), c.uploadedAt());
        if (c.privacySuppressed()) {
            clip.suppress();
        }
        return clip;
    }
}
