package com.playlistgen.recommender;

import java.io.IOException;
import java.util.List;

/**
 * Interface for exporting the ordered list of accepted recommendations.
 */
public interface PlaylistWriterInterface {
    /**
     * Writes the accepted results, preserving their order.
     * @param playlistName Name of the generated playlist
     * @param results Accepted candidates in acceptance order
     * @throws IOException if writing fails
     */
    void writePlaylist(String playlistName, List<CandidateResult> results) throws IOException;
}
