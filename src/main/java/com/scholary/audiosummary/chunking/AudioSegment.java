package com.scholary.audiosummary.chunking;

import java.nio.file.Path;

/**
 * A clipped segment on local disk. The index defines reassembly order.
 *
 * <p>Segments live in a per-run scratch directory and are deleted with it.
 */
public record AudioSegment(int index, double start, double duration, Path path) {}
