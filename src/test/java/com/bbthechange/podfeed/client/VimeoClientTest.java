package com.bbthechange.podfeed.client;

import com.bbthechange.podfeed.dto.SourceHeader;
import com.bbthechange.podfeed.dto.VideoPage;
import com.bbthechange.podfeed.exception.VimeoException;
import com.bbthechange.podfeed.model.SourceType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VimeoClientTest {

    private static final String BASE_URL = "https://api.vimeo.com";

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> httpResponse;

    private VimeoClient vimeoClient;

    @BeforeEach
    void setUp() {
        vimeoClient = new VimeoClient(httpClient, new ObjectMapper(), BASE_URL, "secret-token", Duration.ofSeconds(5));
    }

    private void respondWith(int status, String body) throws Exception {
        when(httpClient.send(any(HttpRequest.class), eq(HttpResponse.BodyHandlers.ofString())))
                .thenReturn(httpResponse);
        when(httpResponse.statusCode()).thenReturn(status);
        if (body != null) {
            when(httpResponse.body()).thenReturn(body);
        }
    }

    private HttpRequest capturedRequest() throws Exception {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), eq(HttpResponse.BodyHandlers.ofString()));
        return captor.getValue();
    }

    @Nested
    @DisplayName("getSourceHeader")
    class GetSourceHeaderTests {

        @Test
        @DisplayName("should map channel metadata and owner")
        void getSourceHeader_Channel_MapsFields() throws Exception {
            // Given
            String json = """
                {
                    "uri": "/channels/staffpicks",
                    "name": "Vimeo Staff Picks",
                    "link": "https://vimeo.com/channels/staffpicks",
                    "description": "We really love videos.",
                    "created_time": "2008-02-26T23:12:10+00:00",
                    "pictures": {"sizes": [
                        {"width": 100, "height": 75, "link": "https://i.vimeocdn.com/100x75.jpg"},
                        {"width": 1920, "height": 1080, "link": "https://i.vimeocdn.com/1920x1080.jpg"}
                    ]},
                    "user": {"name": "Vimeo Curation"},
                    "metadata": {"connections": {}}
                }
                """;
            respondWith(200, json);

            // When
            SourceHeader header = vimeoClient.getSourceHeader(SourceType.CHANNEL, "staffpicks");

            // Then
            assertThat(header.getTitle()).isEqualTo("Vimeo Staff Picks");
            assertThat(header.getLink()).isEqualTo("https://vimeo.com/channels/staffpicks");
            assertThat(header.getDescription()).isEqualTo("We really love videos.");
            assertThat(header.getAuthor()).isEqualTo("Vimeo Curation");
            assertThat(header.getCreatedTime()).isEqualTo(Instant.parse("2008-02-26T23:12:10Z"));
            assertThat(header.getPictures()).hasSize(2);

            HttpRequest request = capturedRequest();
            assertThat(request.uri().toString()).isEqualTo(BASE_URL + "/channels/staffpicks");
            assertThat(request.headers().firstValue("Authorization")).contains("bearer secret-token");
        }

        @Test
        @DisplayName("should take description from bio and author from the user's own name")
        void getSourceHeader_User_UsesBioAndOwnName() throws Exception {
            // Given
            String json = """
                {"name": "Motion Array", "link": "https://vimeo.com/motionarray",
                 "bio": "Templates and stock footage", "created_time": "2013-03-01T10:00:00+00:00"}
                """;
            respondWith(200, json);

            // When
            SourceHeader header = vimeoClient.getSourceHeader(SourceType.USER, "motionarray");

            // Then
            assertThat(header.getDescription()).isEqualTo("Templates and stock footage");
            assertThat(header.getAuthor()).isEqualTo("Motion Array");
            assertThat(header.getPictures()).isEmpty();
            assertThat(capturedRequest().uri().getPath()).isEqualTo("/users/motionarray");
        }

        @Test
        @DisplayName("should classify 404 as NOT_FOUND")
        void getSourceHeader_NotFound_ThrowsNotFound() throws Exception {
            // Given
            respondWith(404, null);

            // When/Then
            assertThatThrownBy(() -> vimeoClient.getSourceHeader(SourceType.GROUP, "missing"))
                    .isInstanceOf(VimeoException.class)
                    .satisfies(e -> {
                        VimeoException ex = (VimeoException) e;
                        assertThat(ex.getErrorType()).isEqualTo(VimeoException.ErrorType.NOT_FOUND);
                        assertThat(ex.getStatusCode()).isEqualTo(404);
                    });
        }

        @Test
        @DisplayName("should classify server errors as TRANSIENT with the status")
        void getSourceHeader_ServerError_ThrowsTransient() throws Exception {
            // Given
            respondWith(503, null);

            // When/Then
            assertThatThrownBy(() -> vimeoClient.getSourceHeader(SourceType.CHANNEL, "staffpicks"))
                    .isInstanceOf(VimeoException.class)
                    .hasMessageContaining("503")
                    .satisfies(e -> {
                        VimeoException ex = (VimeoException) e;
                        assertThat(ex.getErrorType()).isEqualTo(VimeoException.ErrorType.TRANSIENT);
                        assertThat(ex.getStatusCode()).isEqualTo(503);
                    });
        }

        @Test
        @DisplayName("should classify transport failures as TRANSIENT without status")
        void getSourceHeader_IoFailure_ThrowsTransient() throws Exception {
            // Given
            when(httpClient.send(any(HttpRequest.class), eq(HttpResponse.BodyHandlers.ofString())))
                    .thenThrow(new IOException("connection reset"));

            // When/Then
            assertThatThrownBy(() -> vimeoClient.getSourceHeader(SourceType.CHANNEL, "staffpicks"))
                    .isInstanceOf(VimeoException.class)
                    .hasCauseInstanceOf(IOException.class)
                    .satisfies(e -> {
                        VimeoException ex = (VimeoException) e;
                        assertThat(ex.getErrorType()).isEqualTo(VimeoException.ErrorType.TRANSIENT);
                        assertThat(ex.getStatusCode()).isNull();
                    });
        }

        @Test
        @DisplayName("should name only the request in the error message")
        void getSourceHeader_ServerError_MessageNamesRequest() throws Exception {
            // Given
            respondWith(500, null);

            // When/Then
            assertThatThrownBy(() -> vimeoClient.getSourceHeader(SourceType.CHANNEL, "staffpicks"))
                    .isInstanceOf(VimeoException.class)
                    .hasMessage("Vimeo request GET /channels/staffpicks failed (status 500)");
        }

        @Test
        @DisplayName("should classify a JSON null body as TRANSIENT")
        void getSourceHeader_NullBody_ThrowsTransient() throws Exception {
            // Given
            respondWith(200, "null");

            // When/Then
            assertThatThrownBy(() -> vimeoClient.getSourceHeader(SourceType.CHANNEL, "staffpicks"))
                    .isInstanceOf(VimeoException.class)
                    .hasMessageContaining("empty response")
                    .satisfies(e -> {
                        VimeoException ex = (VimeoException) e;
                        assertThat(ex.getErrorType()).isEqualTo(VimeoException.ErrorType.TRANSIENT);
                        assertThat(ex.getStatusCode()).isEqualTo(200);
                    });
        }

        @Test
        @DisplayName("should classify an unreadable body as TRANSIENT")
        void getSourceHeader_MalformedBody_ThrowsTransient() throws Exception {
            // Given
            respondWith(200, "<html>maintenance</html>");

            // When/Then
            assertThatThrownBy(() -> vimeoClient.getSourceHeader(SourceType.CHANNEL, "staffpicks"))
                    .isInstanceOf(VimeoException.class)
                    .satisfies(e -> assertThat(((VimeoException) e).getErrorType())
                            .isEqualTo(VimeoException.ErrorType.TRANSIENT));
        }
    }

    @Nested
    @DisplayName("listVideos")
    class ListVideosTests {

        @Test
        @DisplayName("should map videos and report the next page")
        void listVideos_MiddlePage_MapsVideosAndNextPage() throws Exception {
            // Given
            String json = """
                {
                    "total": 120, "page": 2, "per_page": 50,
                    "paging": {"next": "/groups/motion/videos?page=3", "previous": "/groups/motion/videos?page=1",
                               "first": "/groups/motion/videos?page=1", "last": "/groups/motion/videos?page=3"},
                    "data": [
                        {"uri": "/videos/76979871", "name": "The New Vimeo Player", "description": "Meet it",
                         "link": "https://vimeo.com/76979871", "duration": 62, "width": 1280, "height": 720,
                         "created_time": "2013-10-15T14:08:29+00:00",
                         "pictures": {"sizes": [{"width": 100, "height": 75, "link": "thumb-small.jpg"}]}},
                        {"uri": "/videos/1084537", "name": "Big Buck Bunny", "link": "https://vimeo.com/1084537",
                         "duration": 596, "width": 640, "height": 360, "created_time": "2008-05-30T09:00:00+00:00"}
                    ]
                }
                """;
            respondWith(200, json);

            // When
            VideoPage page = vimeoClient.listVideos(SourceType.GROUP, "motion", 2, 50);

            // Then
            assertThat(page.hasNextPage()).isTrue();
            assertThat(page.getVideos()).hasSize(2);
            assertThat(page.getVideos().get(0).getId()).isEqualTo("76979871");
            assertThat(page.getVideos().get(0).getDuration()).isEqualTo(62);
            assertThat(page.getVideos().get(0).getPictures()).hasSize(1);
            assertThat(page.getVideos().get(1).getTitle()).isEqualTo("Big Buck Bunny");
            assertThat(page.getVideos().get(1).getPictures()).isEmpty();

            assertThat(capturedRequest().uri().toString())
                    .isEqualTo(BASE_URL + "/groups/motion/videos?page=2&per_page=50");
        }

        @Test
        @DisplayName("should report no next page on the last page")
        void listVideos_LastPage_HasNoNextPage() throws Exception {
            // Given
            respondWith(200, """
                {"page": 1, "per_page": 50, "paging": {"next": null}, "data": []}
                """);

            // When
            VideoPage page = vimeoClient.listVideos(SourceType.USER, "motionarray", 1, 50);

            // Then
            assertThat(page.hasNextPage()).isFalse();
            assertThat(page.getVideos()).isEmpty();
        }

        @Test
        @DisplayName("should classify a JSON null listing as TRANSIENT")
        void listVideos_NullBody_ThrowsTransient() throws Exception {
            // Given
            respondWith(200, "null");

            // When/Then
            assertThatThrownBy(() -> vimeoClient.listVideos(SourceType.GROUP, "motion", 1, 50))
                    .isInstanceOf(VimeoException.class)
                    .satisfies(e -> assertThat(((VimeoException) e).getErrorType())
                            .isEqualTo(VimeoException.ErrorType.TRANSIENT));
        }

        @Test
        @DisplayName("should classify 404 during listing as NOT_FOUND, leaving the policy to the caller")
        void listVideos_NotFound_ThrowsNotFound() throws Exception {
            // Given
            respondWith(404, null);

            // When/Then
            assertThatThrownBy(() -> vimeoClient.listVideos(SourceType.CHANNEL, "gone", 3, 50))
                    .isInstanceOf(VimeoException.class)
                    .satisfies(e -> assertThat(((VimeoException) e).isNotFound()).isTrue());
        }
    }

    @Test
    void parseTimestamp_MalformedOrMissing_ReturnsNull() {
        assertThat(VimeoClient.parseTimestamp(null)).isNull();
        assertThat(VimeoClient.parseTimestamp("")).isNull();
        assertThat(VimeoClient.parseTimestamp("yesterday")).isNull();
        assertThat(VimeoClient.parseTimestamp("2013-10-15T14:08:29+02:00"))
                .isEqualTo(Instant.parse("2013-10-15T12:08:29Z"));
    }
}
