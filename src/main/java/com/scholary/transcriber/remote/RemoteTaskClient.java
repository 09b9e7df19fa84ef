package com.scholary.transcriber.remote;

/**
 * Client for the remote transcription service.
 *
 * <p>This abstraction keeps the lifecycle manager independent of the transport, and lets tests
 * drive it with a mock.
 */
public interface RemoteTaskClient {

  /**
   * Submit a new job.
   *
   * @param url the video URL to transcribe
   * @param keepAudio whether the remote side should retain the extracted audio for download
   * @param encryptedSecret opaque ciphertext forwarded as-is, or {@code null}
   * @return the remote-assigned task id
   * @throws SubmissionException if the job is not accepted
   */
  String submit(String url, boolean keepAudio, String encryptedSecret);

  /**
   * Query the status of a job.
   *
   * @throws TransientRemoteException on any transport-level fault
   */
  PollResult poll(String taskId);

  /**
   * Download the retained audio of a finished job.
   *
   * @throws AudioNotAvailableException if there is no audio for the task
   * @throws TransientRemoteException on any transport-level fault
   */
  byte[] fetchAudio(String taskId);

  /**
   * Delete the remote copy of a job's audio. Idempotent: deleting missing audio succeeds.
   *
   * @throws TransientRemoteException on any transport-level fault
   */
  void deleteAudio(String taskId);

  /**
   * Purge remote audio older than the given age.
   *
   * @return number of deleted remote files, never negative
   */
  int cleanup(int maxAgeHours);
}
