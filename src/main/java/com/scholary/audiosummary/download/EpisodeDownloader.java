package com.scholary.audiosummary.download;

import com.scholary.audiosummary.pipeline.CancellationSignal;
import java.nio.file.Path;

/** Fetches source audio from the network. */
public interface EpisodeDownloader {

  /**
   * Stream {@code url} into {@code target}. On failure no partial file is left behind.
   *
   * @return the number of bytes written
   * @throws com.scholary.audiosummary.error.DownloadFailedException if the fetch fails
   * @throws com.scholary.audiosummary.error.PipelineCancelledException if cancelled mid-transfer
   */
  long download(String url, Path target, CancellationSignal signal);
}
