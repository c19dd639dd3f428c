package com.scholary.whisper.gateway.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.whisper.gateway.config.GatewayProperties;
import com.scholary.whisper.gateway.config.GatewayProperties.UploadMode;
import com.scholary.whisper.gateway.whisper.MetricsSnapshot;
import com.scholary.whisper.gateway.whisper.TranscriptSegment;
import com.scholary.whisper.gateway.whisper.TranscriptionResult;
import com.scholary.whisper.gateway.whisper.WhisperApplicationException;
import com.scholary.whisper.gateway.whisper.WhisperService;
import com.scholary.whisper.gateway.whisper.WhisperTask;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TranscriptionServiceTest {

  private static final TranscriptionResult BACKEND_RESULT =
      new TranscriptionResult(
          "hello world", "en", List.of(new TranscriptSegment("hello world", 0.0, 1.5)), 42.0, null);

  @Mock private WhisperService whisperService;

  @TempDir Path tempDir;

  @Test
  void transcribe_shouldSendBytesInlineInBytesMode() {
    TranscriptionService service = service(UploadMode.BYTES);
    byte[] audio = "audio".getBytes(StandardCharsets.UTF_8);
    when(whisperService.transcribeByBytes(audio, "small", "de", WhisperTask.TRANSLATE))
        .thenReturn(BACKEND_RESULT);

    TranscriptionResult result =
        service.transcribe(
            new AudioUpload("talk.wav", audio),
            new TranscriptionOptions("small", "de", WhisperTask.TRANSLATE));

    assertThat(result.text()).isEqualTo("hello world");
    assertThat(result.segments()).hasSize(1);
    verify(whisperService, never()).transcribeByPath(any(), anyString(), any(), any());
  }

  @Test
  void transcribe_shouldReplaceBackendProcessingTimeWithOwnElapsedTime() {
    TranscriptionService service = service(UploadMode.BYTES);
    when(whisperService.transcribeByBytes(any(), anyString(), any(), any()))
        .thenReturn(BACKEND_RESULT);

    TranscriptionResult result =
        service.transcribe(
            new AudioUpload("talk.wav", new byte[] {1}),
            new TranscriptionOptions(null, null, null));

    assertThat(result.processingTime()).isNotEqualTo(42.0).isGreaterThanOrEqualTo(0.0);
  }

  @Test
  void transcribe_shouldApplyDefaultModelAndTask() {
    TranscriptionService service = service(UploadMode.BYTES);
    when(whisperService.transcribeByBytes(any(), eq("base"), isNull(), eq(WhisperTask.TRANSCRIBE)))
        .thenReturn(BACKEND_RESULT);

    service.transcribe(
        new AudioUpload("talk.wav", new byte[] {1}), new TranscriptionOptions(" ", null, null));

    verify(whisperService)
        .transcribeByBytes(any(), eq("base"), isNull(), eq(WhisperTask.TRANSCRIBE));
  }

  @Test
  void transcribe_shouldStoreUploadAndSendPathInPathMode() {
    TranscriptionService service = service(UploadMode.PATH);
    AtomicReference<Path> sentPath = new AtomicReference<>();
    AtomicReference<String> contentAtCallTime = new AtomicReference<>();
    when(whisperService.transcribeByPath(any(), eq("base"), eq("en"), eq(WhisperTask.TRANSCRIBE)))
        .thenAnswer(
            invocation -> {
              Path path = invocation.getArgument(0);
              sentPath.set(path);
              contentAtCallTime.set(Files.readString(path));
              return BACKEND_RESULT;
            });

    service.transcribe(
        new AudioUpload("meeting.mp3", "mp3 bytes".getBytes(StandardCharsets.UTF_8)),
        new TranscriptionOptions("base", "en", WhisperTask.TRANSCRIBE));

    assertThat(sentPath.get().getParent()).isEqualTo(tempDir);
    assertThat(sentPath.get().getFileName().toString()).startsWith("upload-").endsWith(".mp3");
    assertThat(contentAtCallTime.get()).isEqualTo("mp3 bytes");
    assertThat(sentPath.get()).doesNotExist();
  }

  @Test
  void transcribe_shouldDeleteStoredUploadWhenBackendFails() throws Exception {
    TranscriptionService service = service(UploadMode.PATH);
    when(whisperService.transcribeByPath(any(), anyString(), any(), any()))
        .thenThrow(new WhisperApplicationException("model not found"));

    assertThatThrownBy(
            () ->
                service.transcribe(
                    new AudioUpload("meeting.mp3", new byte[] {1, 2, 3}),
                    new TranscriptionOptions("base", null, WhisperTask.TRANSCRIBE)))
        .isInstanceOf(WhisperApplicationException.class);

    try (var files = Files.list(tempDir)) {
      assertThat(files).isEmpty();
    }
  }

  @Test
  void backendMetrics_shouldComeFromWhisperService() {
    TranscriptionService service = service(UploadMode.BYTES);
    when(whisperService.metricsSnapshot()).thenReturn(new MetricsSnapshot(3, 1, 250));

    assertThat(service.backendMetrics()).isEqualTo(new MetricsSnapshot(3, 1, 250));
  }

  private TranscriptionService service(UploadMode mode) {
    return new TranscriptionService(
        whisperService, new GatewayProperties(mode, tempDir.toString(), "base", "1.0.0", 2, 100));
  }
}
