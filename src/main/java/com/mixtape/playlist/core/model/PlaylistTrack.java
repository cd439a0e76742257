package com.mixtape.playlist.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Domain entity representing a track placed at a fixed position inside a playlist.
 * Pure domain object with no framework dependencies.
 * <p>
 * A track keeps its position after being soft-deleted; positions are never compacted.
 */
public class PlaylistTrack {

    public static final int MIN_POSITION = 1;
    public static final int MAX_POSITION = 100;

    private final String playlistId;
    private int position;
    private final String trackUri;
    private final String artist;
    private final String title;
    private final String album;
    private boolean deleted;
    private final Instant addedAt;

    public PlaylistTrack(String playlistId, int position, String trackUri, String artist, String title,
                         String album, boolean deleted, Instant addedAt) {
        this.playlistId = Objects.requireNonNull(playlistId, "playlistId must not be null");
        this.position = position;
        this.trackUri = Objects.requireNonNull(trackUri, "trackUri must not be null");
        this.artist = Objects.requireNonNull(artist, "artist must not be null");
        this.title = Objects.requireNonNull(title, "title must not be null");
        this.album = Objects.requireNonNull(album, "album must not be null");
        this.deleted = deleted;
        this.addedAt = Objects.requireNonNull(addedAt, "addedAt must not be null");
    }

    public static boolean isValidPosition(int position) {
        return position >= MIN_POSITION && position <= MAX_POSITION;
    }

    public String getPlaylistId() {
        return playlistId;
    }

    public int getPosition() {
        return position;
    }

    public void setPosition(int position) {
        this.position = position;
    }

    public String getTrackUri() {
        return trackUri;
    }

    public String getArtist() {
        return artist;
    }

    public String getTitle() {
        return title;
    }

    public String getAlbum() {
        return album;
    }

    public boolean isDeleted() {
        return deleted;
    }

    public void setDeleted(boolean deleted) {
        this.deleted = deleted;
    }

    public Instant getAddedAt() {
        return addedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PlaylistTrack that = (PlaylistTrack) o;
        return position == that.position && Objects.equals(playlistId, that.playlistId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(playlistId, position);
    }
}
