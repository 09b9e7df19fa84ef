package com.scholary.transcriber.audio;

import java.util.regex.Pattern;

/** File name helpers shared by audio and subtitle output. */
public final class FileNames {

  private static final Pattern UNSAFE = Pattern.compile("[\\\\/:*?\"<>|\\p{Cntrl}]");
  private static final int MAX_LENGTH = 200;

  private FileNames() {}

  /**
   * Replace characters that are invalid in file names on common filesystems.
   *
   * <p>Leading dots are stripped so the result can never be {@code .} or {@code ..}.
   */
  public static String sanitize(String name) {
    String cleaned = UNSAFE.matcher(name).replaceAll("_").trim();
    cleaned = cleaned.replaceFirst("^\\.+", "");
    if (cleaned.length() > MAX_LENGTH) {
      cleaned = cleaned.substring(0, MAX_LENGTH);
    }
    return cleaned.isEmpty() ? "_" : cleaned;
  }
}
