package com.mixtape.playlist.integration;

import com.mixtape.playlist.infrastructure.api.controller.ApiHeaders;
import com.mixtape.playlist.infrastructure.api.dto.AddTracksRequest;
import com.mixtape.playlist.infrastructure.api.dto.CreatePlaylistRequest;
import com.mixtape.playlist.infrastructure.api.dto.ErrorResponse;
import com.mixtape.playlist.infrastructure.api.dto.PlaylistListResponse;
import com.mixtape.playlist.infrastructure.api.dto.PlaylistResponse;
import com.mixtape.playlist.infrastructure.api.dto.PlaylistSummaryResponse;
import com.mixtape.playlist.infrastructure.api.dto.TrackInput;
import com.mixtape.playlist.infrastructure.api.dto.UpdatePlaylistRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-End tests for the playlist endpoints.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class PlaylistEndToEndTest {

    @Autowired
    private TestRestTemplate restTemplate;

    private String userId;

    @BeforeEach
    void setUp() {
        userId = "user-" + UUID.randomUUID().toString().substring(0, 8);
    }

    // ========================================================================
    // Helper Methods
    // ========================================================================

    private <T> ResponseEntity<T> call(HttpMethod method, String url, Object body, Class<T> responseType) {
        return callAs(userId, method, url, body, responseType);
    }

    private <T> ResponseEntity<T> callAs(String caller, HttpMethod method, String url, Object body, Class<T> responseType) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(ApiHeaders.USER_ID, caller);
        return restTemplate.exchange(url, method, new HttpEntity<>(body, headers), responseType);
    }

    private PlaylistResponse createPlaylist(String name, String description) {
        ResponseEntity<PlaylistResponse> response = call(HttpMethod.POST, "/playlists",
                new CreatePlaylistRequest(name, description), PlaylistResponse.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        return response.getBody();
    }

    private ResponseEntity<ErrorResponse> createPlaylistExpectingError(String name, String description) {
        return call(HttpMethod.POST, "/playlists", new CreatePlaylistRequest(name, description), ErrorResponse.class);
    }

    private PlaylistListResponse listPlaylists(String query) {
        ResponseEntity<PlaylistListResponse> response = call(HttpMethod.GET, "/playlists" + query, null,
                PlaylistListResponse.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        return response.getBody();
    }

    private List<String> listedNames(String query) {
        return listPlaylists(query).items().stream().map(PlaylistSummaryResponse::name).toList();
    }

    private void addTracks(String playlistId, String... uris) {
        List<TrackInput> tracks = Arrays.stream(uris)
                .map(uri -> new TrackInput(uri, "Artist", "Title " + uri, "Album"))
                .toList();
        ResponseEntity<String> response = call(HttpMethod.POST, "/playlists/" + playlistId + "/tracks",
                new AddTracksRequest(tracks, 0), String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
    }

    private static void assertError(ResponseEntity<ErrorResponse> response, HttpStatusCode status, String code) {
        assertThat(response.getStatusCode()).isEqualTo(status);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().error().code()).isEqualTo(code);
    }

    // ========================================================================
    // 1. Create
    // ========================================================================

    @Nested
    @DisplayName("1. Create")
    class CreateTests {

        @Test
        @DisplayName("Created playlist is returned with timestamps")
        void createsPlaylist() {
            PlaylistResponse playlist = createPlaylist("Morning Run", "Fast songs");

            assertThat(playlist.id()).isNotBlank();
            assertThat(playlist.name()).isEqualTo("Morning Run");
            assertThat(playlist.description()).isEqualTo("Fast songs");
            assertThat(playlist.createdAt()).isNotNull();
            assertThat(playlist.updatedAt()).isNotNull();
            assertThat(playlist.trackCount()).isNull();
        }

        @Test
        @DisplayName("Description is optional")
        void createsWithoutDescription() {
            PlaylistResponse playlist = createPlaylist("Quiet", null);

            assertThat(playlist.description()).isNull();
        }

        @Test
        @DisplayName("Blank or overlong fields return 400")
        void rejectsInvalidFields() {
            assertError(createPlaylistExpectingError("   ", null), HttpStatus.BAD_REQUEST, "VALIDATION_ERROR");
            assertError(createPlaylistExpectingError(null, null), HttpStatus.BAD_REQUEST, "VALIDATION_ERROR");
            assertError(createPlaylistExpectingError("x".repeat(101), null), HttpStatus.BAD_REQUEST, "VALIDATION_ERROR");
            assertError(createPlaylistExpectingError("ok", "d".repeat(256)), HttpStatus.BAD_REQUEST, "VALIDATION_ERROR");

            assertThat(createPlaylist("x".repeat(100), "d".repeat(255)).name()).hasSize(100);
        }

        @Test
        @DisplayName("Same name differing only in case returns 409")
        void rejectsDuplicateName() {
            createPlaylist("Chill", null);

            assertError(createPlaylistExpectingError("CHILL", null), HttpStatus.CONFLICT, "CONFLICT");
        }

        @Test
        @DisplayName("Different owners may use the same name")
        void allowsSameNameForOtherOwner() {
            createPlaylist("Chill", null);

            ResponseEntity<PlaylistResponse> response = callAs("someone-else-" + userId, HttpMethod.POST, "/playlists",
                    new CreatePlaylistRequest("Chill", null), PlaylistResponse.class);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        }

        @Test
        @DisplayName("Name of a deleted playlist can be reused")
        void reusesDeletedName() {
            PlaylistResponse first = createPlaylist("Chill", null);
            call(HttpMethod.DELETE, "/playlists/" + first.id(), null, Void.class);

            assertThat(createPlaylist("Chill", null).id()).isNotEqualTo(first.id());
        }

        @Test
        @DisplayName("51st playlist returns 422 until one is deleted")
        void enforcesPerOwnerLimit() {
            String firstId = null;
            for (int i = 1; i <= 50; i++) {
                PlaylistResponse playlist = createPlaylist("List " + i, null);
                if (firstId == null) {
                    firstId = playlist.id();
                }
            }

            ResponseEntity<ErrorResponse> response = createPlaylistExpectingError("List 51", null);
            assertError(response, HttpStatus.UNPROCESSABLE_ENTITY, "LIMIT_EXCEEDED");
            assertThat(response.getBody().error().details()).isEqualTo(Map.of("maxCount", 50));

            call(HttpMethod.DELETE, "/playlists/" + firstId, null, Void.class);
            assertThat(createPlaylist("List 51", null).name()).isEqualTo("List 51");
        }
    }

    // ========================================================================
    // 2. Read
    // ========================================================================

    @Nested
    @DisplayName("2. Read")
    class ReadTests {

        @Test
        @DisplayName("Single playlist carries its live track count")
        void getsPlaylistWithTrackCount() {
            PlaylistResponse created = createPlaylist("Gym", "Heavy");
            addTracks(created.id(), "a", "b", "c");
            call(HttpMethod.DELETE, "/playlists/" + created.id() + "/tracks/2", null, Void.class);

            ResponseEntity<PlaylistResponse> response = call(HttpMethod.GET, "/playlists/" + created.id(), null,
                    PlaylistResponse.class);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(response.getBody().name()).isEqualTo("Gym");
            assertThat(response.getBody().description()).isEqualTo("Heavy");
            assertThat(response.getBody().trackCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("Unknown or foreign playlist returns 404")
        void hidesMissingAndForeignPlaylists() {
            PlaylistResponse created = createPlaylist("Private", null);

            assertError(call(HttpMethod.GET, "/playlists/does-not-exist", null, ErrorResponse.class),
                    HttpStatus.NOT_FOUND, "NOT_FOUND");
            assertError(callAs("intruder", HttpMethod.GET, "/playlists/" + created.id(), null, ErrorResponse.class),
                    HttpStatus.NOT_FOUND, "NOT_FOUND");
        }

        @Test
        @DisplayName("Missing identity header returns 401")
        void rejectsAnonymousCaller() {
            ResponseEntity<ErrorResponse> response = restTemplate.getForEntity("/playlists", ErrorResponse.class);

            assertError(response, HttpStatus.UNAUTHORIZED, "UNAUTHORIZED");
        }
    }

    // ========================================================================
    // 3. List
    // ========================================================================

    @Nested
    @DisplayName("3. List")
    class ListTests {

        @Test
        @DisplayName("Listing shows only the caller's live playlists with track counts")
        void listsOwnPlaylists() {
            PlaylistResponse kept = createPlaylist("Kept", null);
            PlaylistResponse dropped = createPlaylist("Dropped", null);
            addTracks(kept.id(), "a", "b");
            call(HttpMethod.DELETE, "/playlists/" + dropped.id(), null, Void.class);
            callAs("neighbour-" + userId, HttpMethod.POST, "/playlists", new CreatePlaylistRequest("Theirs", null), String.class);

            PlaylistListResponse body = listPlaylists("");

            assertThat(body.total()).isEqualTo(1);
            assertThat(body.page()).isEqualTo(1);
            assertThat(body.pageSize()).isEqualTo(20);
            assertThat(body.items()).singleElement().satisfies(item -> {
                assertThat(item.id()).isEqualTo(kept.id());
                assertThat(item.trackCount()).isEqualTo(2);
            });
        }

        @Test
        @DisplayName("Sort by name in both directions")
        void sortsByName() {
            createPlaylist("Beta", null);
            createPlaylist("Alpha", null);
            createPlaylist("Gamma", null);

            assertThat(listedNames("?sort=name.asc")).containsExactly("Alpha", "Beta", "Gamma");
            assertThat(listedNames("?sort=NAME.DESC")).containsExactly("Gamma", "Beta", "Alpha");
        }

        @Test
        @DisplayName("Sort by creation time")
        void sortsByCreation() throws InterruptedException {
            createPlaylist("First", null);
            Thread.sleep(5);
            createPlaylist("Second", null);

            assertThat(listedNames("?sort=created_at.asc")).containsExactly("First", "Second");
            assertThat(listedNames("?sort=created_at.desc")).containsExactly("Second", "First");
        }

        @Test
        @DisplayName("Search matches names case-insensitively")
        void searchesByName() {
            createPlaylist("Summer Hits", null);
            createPlaylist("Winter Mix", null);
            createPlaylist("Late summer", null);

            PlaylistListResponse body = listPlaylists("?search=SUMMER&sort=name.asc");

            assertThat(body.total()).isEqualTo(2);
            assertThat(body.items()).extracting(PlaylistSummaryResponse::name).containsExactly("Late summer", "Summer Hits");
        }

        @Test
        @DisplayName("Pages split the listing")
        void paginates() {
            for (String name : List.of("a", "b", "c", "d", "e")) {
                createPlaylist(name, null);
            }

            PlaylistListResponse second = listPlaylists("?page=2&pageSize=2&sort=name.asc");

            assertThat(second.total()).isEqualTo(5);
            assertThat(second.items()).extracting(PlaylistSummaryResponse::name).containsExactly("c", "d");
        }

        @Test
        @DisplayName("Invalid sort or pagination returns 400")
        void rejectsInvalidQuery() {
            for (String query : List.of("?sort=owner.asc", "?sort=name", "?page=0", "?pageSize=101", "?page=51&pageSize=100")) {
                ResponseEntity<ErrorResponse> response = call(HttpMethod.GET, "/playlists" + query, null, ErrorResponse.class);
                assertError(response, HttpStatus.BAD_REQUEST, "VALIDATION_ERROR");
            }
        }
    }

    // ========================================================================
    // 4. Update
    // ========================================================================

    @Nested
    @DisplayName("4. Update")
    class UpdateTests {

        private PlaylistResponse playlist;

        @BeforeEach
        void createTarget() {
            playlist = createPlaylist("Original", "Before");
        }

        private ResponseEntity<PlaylistResponse> patch(Object body) {
            return call(HttpMethod.PATCH, "/playlists/" + playlist.id(), body, PlaylistResponse.class);
        }

        @Test
        @DisplayName("Name only leaves description untouched")
        void renames() {
            ResponseEntity<PlaylistResponse> response = patch(new UpdatePlaylistRequest("Renamed", null));

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(response.getBody().name()).isEqualTo("Renamed");
            assertThat(response.getBody().description()).isEqualTo("Before");
            assertThat(response.getBody().updatedAt()).isAfterOrEqualTo(playlist.updatedAt());
        }

        @Test
        @DisplayName("Description only leaves name untouched")
        void redescribes() {
            ResponseEntity<PlaylistResponse> response = patch(new UpdatePlaylistRequest(null, "After"));

            assertThat(response.getBody().name()).isEqualTo("Original");
            assertThat(response.getBody().description()).isEqualTo("After");
        }

        @Test
        @DisplayName("Explicit null description clears it")
        void clearsDescription() {
            HttpHeaders headers = new HttpHeaders();
            headers.set(ApiHeaders.USER_ID, userId);
            headers.set(HttpHeaders.CONTENT_TYPE, "application/json");

            ResponseEntity<PlaylistResponse> response = restTemplate.exchange("/playlists/" + playlist.id(),
                    HttpMethod.PATCH, new HttpEntity<>("{\"description\": null}", headers), PlaylistResponse.class);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(response.getBody().name()).isEqualTo("Original");
            assertThat(response.getBody().description()).isNull();
            assertThat(call(HttpMethod.GET, "/playlists/" + playlist.id(), null, PlaylistResponse.class)
                    .getBody().description()).isNull();
        }

        @Test
        @DisplayName("Explicit null name returns 400")
        void rejectsNullName() {
            HttpHeaders headers = new HttpHeaders();
            headers.set(ApiHeaders.USER_ID, userId);
            headers.set(HttpHeaders.CONTENT_TYPE, "application/json");

            ResponseEntity<ErrorResponse> response = restTemplate.exchange("/playlists/" + playlist.id(),
                    HttpMethod.PATCH, new HttpEntity<>("{\"name\": null}", headers), ErrorResponse.class);

            assertError(response, HttpStatus.BAD_REQUEST, "VALIDATION_ERROR");
            assertThat(call(HttpMethod.GET, "/playlists/" + playlist.id(), null, PlaylistResponse.class)
                    .getBody().name()).isEqualTo("Original");
        }

        @Test
        @DisplayName("Changing only the case of its own name is allowed")
        void recasesOwnName() {
            assertThat(patch(new UpdatePlaylistRequest("ORIGINAL", null)).getBody().name()).isEqualTo("ORIGINAL");
        }

        @Test
        @DisplayName("Empty body returns 400")
        void rejectsEmptyPatch() {
            ResponseEntity<ErrorResponse> response = call(HttpMethod.PATCH, "/playlists/" + playlist.id(), Map.of(),
                    ErrorResponse.class);

            assertError(response, HttpStatus.BAD_REQUEST, "VALIDATION_ERROR");
        }

        @Test
        @DisplayName("Blank name returns 400")
        void rejectsBlankName() {
            ResponseEntity<ErrorResponse> response = call(HttpMethod.PATCH, "/playlists/" + playlist.id(),
                    new UpdatePlaylistRequest("  ", null), ErrorResponse.class);

            assertError(response, HttpStatus.BAD_REQUEST, "VALIDATION_ERROR");
        }

        @Test
        @DisplayName("Name taken by another playlist returns 409")
        void rejectsTakenName() {
            createPlaylist("Taken", null);

            ResponseEntity<ErrorResponse> response = call(HttpMethod.PATCH, "/playlists/" + playlist.id(),
                    new UpdatePlaylistRequest("taken", null), ErrorResponse.class);

            assertError(response, HttpStatus.CONFLICT, "CONFLICT");
        }

        @Test
        @DisplayName("Foreign playlist returns 404")
        void rejectsForeignPlaylist() {
            ResponseEntity<ErrorResponse> response = callAs("intruder", HttpMethod.PATCH, "/playlists/" + playlist.id(),
                    new UpdatePlaylistRequest("Hijacked", null), ErrorResponse.class);

            assertError(response, HttpStatus.NOT_FOUND, "NOT_FOUND");
        }
    }

    // ========================================================================
    // 5. Delete
    // ========================================================================

    @Nested
    @DisplayName("5. Delete")
    class DeleteTests {

        @Test
        @DisplayName("Deleted playlist and its tracks disappear")
        void deletesWithTracks() {
            PlaylistResponse playlist = createPlaylist("Doomed", null);
            addTracks(playlist.id(), "a", "b");

            ResponseEntity<Void> response = call(HttpMethod.DELETE, "/playlists/" + playlist.id(), null, Void.class);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
            assertError(call(HttpMethod.GET, "/playlists/" + playlist.id(), null, ErrorResponse.class),
                    HttpStatus.NOT_FOUND, "NOT_FOUND");
            assertError(call(HttpMethod.GET, "/playlists/" + playlist.id() + "/tracks", null, ErrorResponse.class),
                    HttpStatus.NOT_FOUND, "NOT_FOUND");
            assertThat(listPlaylists("").total()).isZero();
        }

        @Test
        @DisplayName("Second delete returns 404")
        void deleteTwice() {
            PlaylistResponse playlist = createPlaylist("Once", null);
            call(HttpMethod.DELETE, "/playlists/" + playlist.id(), null, Void.class);

            assertError(call(HttpMethod.DELETE, "/playlists/" + playlist.id(), null, ErrorResponse.class),
                    HttpStatus.NOT_FOUND, "NOT_FOUND");
        }

        @Test
        @DisplayName("Foreign playlist is not deleted")
        void rejectsForeignDelete() {
            PlaylistResponse playlist = createPlaylist("Mine", null);

            assertError(callAs("intruder", HttpMethod.DELETE, "/playlists/" + playlist.id(), null, ErrorResponse.class),
                    HttpStatus.NOT_FOUND, "NOT_FOUND");
            assertThat(call(HttpMethod.GET, "/playlists/" + playlist.id(), null, PlaylistResponse.class).getStatusCode())
                    .isEqualTo(HttpStatus.OK);
        }
    }

    // ========================================================================
    // 6. Health
    // ========================================================================

    @Test
    @DisplayName("Health endpoint needs no identity")
    void healthIsUp() {
        ResponseEntity<Map<String, String>> response = restTemplate.exchange("/health", HttpMethod.GET, null,
                new ParameterizedTypeReference<Map<String, String>>() {});

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).containsEntry("status", "UP");
    }
}
