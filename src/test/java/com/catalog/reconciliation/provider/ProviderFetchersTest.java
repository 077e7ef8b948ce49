package com.catalog.reconciliation.provider;

import com.catalog.reconciliation.core.model.Provider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ProviderFetchersTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    private JsonHttpClient http;

    @BeforeEach
    void setUp() {
        http = mock(JsonHttpClient.class);
    }

    private static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }

    @Nested
    @DisplayName("ArdbFetcher")
    class ArdbTests {

        @Test
        @DisplayName("Should accept a bare array and pick the latest updatedAt as version")
        void testArray() {
            when(http.getJson("https://ardb/items")).thenReturn(json("""
                    [{"id": "a", "updatedAt": "2026-01-02T00:00:00Z"},
                     {"id": "b", "updatedAt": "2026-02-01T00:00:00Z"},
                     {"id": "c"}]
                    """));

            FetchResult result = new ArdbFetcher(http, "https://ardb/items", CLOCK).fetchRaw();

            assertEquals(Provider.ARDB, result.sourceId());
            assertEquals(3, result.itemsRaw().size());
            assertEquals("2026-02-01T00:00:00Z", result.versionOrCommit());
            assertEquals("2026-03-01T12:00:00Z", result.fetchedAt());
        }

        @Test
        @DisplayName("Should unwrap a data envelope and report unknown version without timestamps")
        void testEnvelope() {
            when(http.getJson(anyString())).thenReturn(json("{\"data\": [{\"id\": \"a\"}]}"));

            FetchResult result = new ArdbFetcher(http, "https://ardb/items", CLOCK).fetchRaw();

            assertEquals(1, result.itemsRaw().size());
            assertEquals(FetchResult.UNKNOWN_VERSION, result.versionOrCommit());
        }

        @Test
        @DisplayName("Should attribute HTTP failures to the provider")
        void testFailure() {
            when(http.getJson(anyString())).thenThrow(new ProviderFetchException(null, "Request failed (503)"));

            ProviderFetchException thrown = assertThrows(ProviderFetchException.class,
                    () -> new ArdbFetcher(http, "https://ardb/items", CLOCK).fetchRaw());

            assertEquals(Provider.ARDB, thrown.getProvider());
            assertEquals("Request failed (503)", thrown.getMessage());
        }
    }

    @Nested
    @DisplayName("MetaForgeFetcher")
    class MetaForgeTests {

        @Test
        @DisplayName("Should follow pages up to totalPages")
        void testPagination() {
            when(http.getJson("https://mf/items?limit=2&page=1&includeComponents=true")).thenReturn(json("""
                    {"data": [{"id": "a", "updated_at": "2026-01-01"}, {"id": "b"}],
                     "pagination": {"totalPages": 2, "hasNextPage": true}}
                    """));
            when(http.getJson("https://mf/items?limit=2&page=2&includeComponents=true")).thenReturn(json("""
                    {"data": [{"id": "c", "updated_at": "2026-01-05"}],
                     "pagination": {"totalPages": 2, "hasNextPage": false}}
                    """));

            FetchResult result = new MetaForgeFetcher(http, "https://mf/items", 2, true, CLOCK).fetchRaw();

            assertEquals(3, result.itemsRaw().size());
            assertEquals("2026-01-05", result.versionOrCommit());
            verify(http, times(2)).getJson(anyString());
        }

        @Test
        @DisplayName("Should stop when hasNextPage is false even if totalPages says otherwise")
        void testHasNextPageStops() {
            when(http.getJson("https://mf/items?limit=100&page=1")).thenReturn(json("""
                    {"data": [{"id": "a"}], "pagination": {"totalPages": 5, "hasNextPage": false}}
                    """));

            FetchResult result = new MetaForgeFetcher(http, "https://mf/items", 100, false, CLOCK).fetchRaw();

            assertEquals(1, result.itemsRaw().size());
            verify(http, times(1)).getJson(anyString());
        }

        @Test
        @DisplayName("Should fetch a single page when pagination is absent")
        void testNoPagination() {
            when(http.getJson(anyString())).thenReturn(json("{\"data\": [{\"id\": \"a\"}]}"));

            FetchResult result = new MetaForgeFetcher(http, "https://mf/items", 100, false, CLOCK).fetchRaw();

            assertEquals(1, result.itemsRaw().size());
            verify(http, times(1)).getJson(anyString());
        }
    }

    @Nested
    @DisplayName("MahcksFetcher")
    class MahcksTests {

        @Test
        @DisplayName("Should prefix the API version and page by offset until next is empty")
        void testPaging() {
            when(http.getJson("https://mahcks/v1")).thenReturn(json("{\"version\": \"2.1\"}"));
            when(http.getJson("https://mahcks/v1/items?full=true&limit=2&offset=0")).thenReturn(json("""
                    {"items": [{"id": "a"}, {"id": "b"}], "next": "/v1/items?offset=2"}
                    """));
            when(http.getJson("https://mahcks/v1/items?full=true&limit=2&offset=2")).thenReturn(json("""
                    {"items": [{"id": "c"}], "next": null}
                    """));

            FetchResult result = new MahcksFetcher(http, "https://mahcks", 2, CLOCK).fetchRaw();

            assertEquals("api-2.1", result.versionOrCommit());
            assertEquals(3, result.itemsRaw().size());
        }

        @Test
        @DisplayName("Should report unknown version when the API root has none")
        void testUnknownVersion() {
            when(http.getJson("https://mahcks/v1")).thenReturn(json("{}"));
            when(http.getJson("https://mahcks/v1/items?full=true&limit=45&offset=0"))
                    .thenReturn(json("{\"items\": []}"));

            FetchResult result = new MahcksFetcher(http, "https://mahcks", 45, CLOCK).fetchRaw();

            assertEquals(FetchResult.UNKNOWN_VERSION, result.versionOrCommit());
            assertTrue(result.itemsRaw().isEmpty());
        }
    }

    @Nested
    @DisplayName("RaidTheoryFetcher")
    class RaidTheoryTests {

        private static final String REPO = "https://gh/repos/owner/repo";

        @Test
        @DisplayName("Should use the latest commit sha and download listed files up to the limit")
        void testDownload() {
            when(http.getJson(REPO + "/commits?sha=main&per_page=1")).thenReturn(json("[{\"sha\": \"abc123\"}]"));
            when(http.getJson(REPO + "/contents/items?ref=main")).thenReturn(json("""
                    [{"type": "file", "download_url": "https://raw/a.json"},
                     {"type": "dir", "download_url": null},
                     {"type": "file", "download_url": "https://raw/b.json"},
                     {"type": "file", "download_url": "https://raw/c.json"}]
                    """));
            when(http.getJson("https://raw/a.json")).thenReturn(json("{\"id\": \"a\"}"));
            when(http.getJson("https://raw/b.json")).thenReturn(json("{\"id\": \"b\"}"));

            FetchResult result = new RaidTheoryFetcher(http, "https://gh", "owner", "repo", "main", "items",
                    4, 2, CLOCK).fetchRaw();

            assertEquals("abc123", result.versionOrCommit());
            assertEquals(2, result.itemsRaw().size());
            assertEquals("a", result.itemsRaw().get(0).get("id").asText());
            assertEquals("b", result.itemsRaw().get(1).get("id").asText());
            verify(http, never()).getJson("https://raw/c.json");
        }

        @Test
        @DisplayName("Should fail with the API message when the listing is not an array")
        void testListingError() {
            when(http.getJson(REPO + "/commits?sha=main&per_page=1")).thenReturn(json("[]"));
            when(http.getJson(REPO + "/contents/items?ref=main"))
                    .thenReturn(json("{\"message\": \"API rate limit exceeded\"}"));

            ProviderFetchException thrown = assertThrows(ProviderFetchException.class,
                    () -> new RaidTheoryFetcher(http, "https://gh", "owner", "repo", "main", "items",
                            4, 0, CLOCK).fetchRaw());

            assertEquals(Provider.RAIDTHEORY, thrown.getProvider());
            assertEquals("API rate limit exceeded", thrown.getMessage());
        }
    }
}
