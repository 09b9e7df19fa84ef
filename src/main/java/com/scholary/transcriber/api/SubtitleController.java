package com.scholary.transcriber.api;

import com.scholary.transcriber.config.TaskProperties;
import com.scholary.transcriber.service.SubtitleExportService;
import com.scholary.transcriber.subtitle.SubtitleCue;
import com.scholary.transcriber.subtitle.SubtitleFormat;
import com.scholary.transcriber.subtitle.SubtitleSynthesizer;
import com.scholary.transcriber.subtitle.SubtitleWriter;
import com.scholary.transcriber.task.CharTimestamp;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST API for subtitle synthesis and export. */
@RestController
@RequestMapping("/api")
@Tag(name = "Subtitles", description = "Subtitle synthesis from character timing")
public class SubtitleController {

  private final SubtitleSynthesizer synthesizer;
  private final SubtitleWriter writer;
  private final SubtitleExportService exportService;
  private final int defaultMinLength;

  public SubtitleController(
      SubtitleSynthesizer synthesizer,
      SubtitleWriter writer,
      SubtitleExportService exportService,
      TaskProperties properties) {
    this.synthesizer = synthesizer;
    this.writer = writer;
    this.exportService = exportService;
    this.defaultMinLength = properties.defaultMinLength();
  }

  @PostMapping("/subtitles")
  @Operation(
      summary = "Synthesize subtitles",
      description = "Segments text with one [start, end] pair per content character into cues.")
  public SubtitleResponse synthesize(@Valid @RequestBody SynthesizeRequest request) {
    int minLength = request.minLength() != null ? request.minLength() : defaultMinLength;
    List<SubtitleCue> cues =
        synthesizer.synthesize(request.text(), toTimestamps(request.timestamps()), minLength);
    return new SubtitleResponse(cues, writer.writeSrt(cues));
  }

  @GetMapping("/tasks/{taskId}/subtitles")
  @Operation(summary = "Render a completed task's subtitles")
  public ResponseEntity<String> render(
      @PathVariable String taskId,
      @RequestParam(defaultValue = "srt") String format,
      @RequestParam(required = false) Integer minLength) {
    SubtitleFormat subtitleFormat = SubtitleFormat.parse(format);
    String content = exportService.render(taskId, minLength, subtitleFormat);
    return ResponseEntity.ok()
        .contentType(MediaType.parseMediaType(subtitleFormat.contentType() + ";charset=UTF-8"))
        .body(content);
  }

  @PostMapping("/tasks/{taskId}/subtitles/export")
  @Operation(summary = "Export a completed task's subtitles to the export directory")
  public ExportResponse export(
      @PathVariable String taskId,
      @RequestParam(defaultValue = "srt") String format,
      @RequestParam(required = false) Integer minLength,
      @RequestParam(required = false) String fileName) {
    SubtitleFormat subtitleFormat = SubtitleFormat.parse(format);
    Path path = exportService.export(taskId, minLength, subtitleFormat, fileName);
    return new ExportResponse(taskId, subtitleFormat.name(), path.toString());
  }

  private static List<CharTimestamp> toTimestamps(List<List<Long>> pairs) {
    List<CharTimestamp> timestamps = new ArrayList<>(pairs.size());
    for (List<Long> pair : pairs) {
      if (pair == null || pair.size() < 2 || pair.get(0) == null || pair.get(1) == null) {
        throw new IllegalArgumentException("Each timestamp must be a [start, end] pair: " + pair);
      }
      timestamps.add(new CharTimestamp(pair.get(0), pair.get(1)));
    }
    return timestamps;
  }
}
