package com.mixtape.playlist.infrastructure.persistence.dao;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;

/**
 * JPA data access object for playlist tracks.
 * The surrogate id lets a reorder change a track's position in place; the unique constraint keeps
 * one row per (playlist, position), removed rows included.
 */
@Entity
@Table(
        name = "playlist_tracks",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_playlist_tracks_position", columnNames = {"playlist_id", "track_position"})
        },
        indexes = {
                @Index(name = "idx_playlist_tracks_playlist_deleted", columnList = "playlist_id, is_deleted")
        }
)
public class PlaylistTrackDao {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "playlist_id", nullable = false, length = 36)
    private String playlistId;

    @Column(name = "track_position", nullable = false)
    private int position;

    @Column(name = "track_uri", nullable = false, length = 500)
    private String trackUri;

    @Column(name = "artist", nullable = false, length = 500)
    private String artist;

    @Column(name = "title", nullable = false, length = 500)
    private String title;

    @Column(name = "album", nullable = false, length = 500)
    private String album;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @Column(name = "added_at", nullable = false, updatable = false)
    private Instant addedAt;

    public PlaylistTrackDao() {
    }

    public PlaylistTrackDao(String id, String playlistId, int position, String trackUri, String artist,
                            String title, String album, boolean deleted, Instant addedAt) {
        this.id = id;
        this.playlistId = playlistId;
        this.position = position;
        this.trackUri = trackUri;
        this.artist = artist;
        this.title = title;
        this.album = album;
        this.deleted = deleted;
        this.addedAt = addedAt;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getPlaylistId() {
        return playlistId;
    }

    public void setPlaylistId(String playlistId) {
        this.playlistId = playlistId;
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

    public void setTrackUri(String trackUri) {
        this.trackUri = trackUri;
    }

    public String getArtist() {
        return artist;
    }

    public void setArtist(String artist) {
        this.artist = artist;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getAlbum() {
        return album;
    }

    public void setAlbum(String album) {
        this.album = album;
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

    public void setAddedAt(Instant addedAt) {
        this.addedAt = addedAt;
    }
}
