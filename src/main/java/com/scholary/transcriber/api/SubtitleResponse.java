package com.scholary.transcriber.api;

import com.scholary.transcriber.subtitle.SubtitleCue;
import java.util.List;

/** Synthesized cues plus their SRT rendering. */
public record SubtitleResponse(List<SubtitleCue> cues, String srt) {}
