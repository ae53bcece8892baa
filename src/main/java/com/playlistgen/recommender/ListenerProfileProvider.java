package com.playlistgen.recommender;

/**
 * Supplies the listener's liked tracks and recent-listening signal.
 */
public interface ListenerProfileProvider {
    /**
     * Loads the profile. Called once at the start of a run.
     * @return ListenerProfile
     * @throws RecommenderException if the profile cannot be loaded
     */
    ListenerProfile loadProfile() throws RecommenderException;
}
