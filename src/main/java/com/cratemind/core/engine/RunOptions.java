package com.cratemind.core.engine;

import java.nio.file.Path;

/**
 * Per-run settings from the command line. Null overrides fall back to configuration.
 *
 * @param catalogFile     enriched track catalog to classify
 * @param provider        provider override, or null
 * @param batchSize       batch size override, or null
 * @param maxRetries      attempt budget override, or null
 * @param outputFile      results file, or null for a timestamped default
 * @param exportPlaylists whether to write per-category playlist files
 * @param playlistDir     directory for playlist files
 */
public record RunOptions(
        Path catalogFile,
        String provider,
        Integer batchSize,
        Integer maxRetries,
        Path outputFile,
        boolean exportPlaylists,
        Path playlistDir
) {

    public static final Path DEFAULT_PLAYLIST_DIR = Path.of("playlists");

    public RunOptions {
        if (playlistDir == null) {
            playlistDir = DEFAULT_PLAYLIST_DIR;
        }
    }

    public static RunOptions forCatalog(Path catalogFile) {
        return new RunOptions(catalogFile, null, null, null, null, true, DEFAULT_PLAYLIST_DIR);
    }
}
