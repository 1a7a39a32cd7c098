/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.noos.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import villagecompute.noos.config.NoosConfig;
import villagecompute.noos.exceptions.ChannelListException;
import villagecompute.noos.exceptions.DuplicateResourceException;
import villagecompute.noos.exceptions.ResourceNotFoundException;
import villagecompute.noos.exceptions.ValidationException;

/**
 * Unit tests for {@link ChannelListService}.
 */
class ChannelListServiceTest {

    @TempDir
    Path tempDir;

    @Mock
    NoosConfig config;

    private ChannelListService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(config.configDir()).thenReturn(tempDir.resolve("config"));

        service = new ChannelListService();
        service.config = config;
        service.clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
    }

    @Test
    void testListChannels_missingFileIsEmpty() {
        assertTrue(service.listChannels().isEmpty());
    }

    @Test
    void testListChannels_skipsBlankAndCommentLines() throws IOException {
        Files.createDirectories(service.channelsFile().getParent());
        Files.writeString(service.channelsFile(),
                "# my feeds\n\nhttps://a.example/rss\n  https://b.example/atom  \n# https://c.example\n",
                StandardCharsets.UTF_8);

        assertEquals(List.of("https://a.example/rss", "https://b.example/atom"), service.listChannels());
    }

    @Test
    void testAddChannel_persistsInOrder() {
        service.addChannel("https://a.example/rss");
        service.addChannel(" https://b.example/atom ");

        assertEquals(List.of("https://a.example/rss", "https://b.example/atom"), service.listChannels());
    }

    @Test
    void testAddChannel_duplicateIsRejected() {
        service.addChannel("https://a.example/rss");

        assertThrows(DuplicateResourceException.class, () -> service.addChannel("https://a.example/rss"));
        assertEquals(1, service.listChannels().size());
    }

    @Test
    void testAddChannel_invalidUrlIsRejected() {
        assertThrows(ValidationException.class, () -> service.addChannel("ftp://a.example/rss"));
        assertThrows(ValidationException.class, () -> service.addChannel("not a url"));
        assertThrows(ValidationException.class, () -> service.addChannel(""));
        assertThrows(ValidationException.class, () -> service.addChannel("https:///nohost"));
    }

    @Test
    void testRemoveChannel() {
        service.addChannel("https://a.example/rss");
        service.addChannel("https://b.example/rss");

        service.removeChannel("https://a.example/rss");

        assertEquals(List.of("https://b.example/rss"), service.listChannels());
    }

    @Test
    void testRemoveChannel_unknownUrlIsRejected() {
        assertThrows(ResourceNotFoundException.class, () -> service.removeChannel("https://nope.example/rss"));
    }

    @Test
    void testImportOpml_collectsNestedOutlinesAndSkipsDuplicates() throws IOException {
        service.addChannel("https://a.example/rss");
        Path opml = tempDir.resolve("subscriptions.opml");
        Files.writeString(opml, """
                <?xml version="1.0" encoding="UTF-8"?>
                <opml version="2.0">
                  <head><title>Subscriptions</title></head>
                  <body>
                    <outline text="A" type="rss" xmlUrl="https://a.example/rss"/>
                    <outline text="Tech">
                      <outline text="B" type="rss" xmlUrl="https://b.example/atom"/>
                      <outline text="Broken" type="rss" xmlUrl="mailto:nobody@example.com"/>
                    </outline>
                    <outline text="C" type="rss" xmlUrl="https://c.example/feed"/>
                  </body>
                </opml>
                """, StandardCharsets.UTF_8);

        int added = service.importOpml(opml);

        assertEquals(2, added);
        assertEquals(List.of("https://a.example/rss", "https://b.example/atom", "https://c.example/feed"),
                service.listChannels());
    }

    @Test
    void testImportOpml_notOpmlFails() throws IOException {
        Path notOpml = tempDir.resolve("feed.xml");
        Files.writeString(notOpml, "this is not xml", StandardCharsets.UTF_8);

        assertThrows(ChannelListException.class, () -> service.importOpml(notOpml));
    }

    @Test
    void testImportOpml_missingFileFails() {
        assertThrows(ChannelListException.class, () -> service.importOpml(tempDir.resolve("missing.opml")));
    }

    @Test
    void testExportOpml_canBeImportedElsewhere() throws IOException {
        service.addChannel("https://a.example/rss");
        service.addChannel("https://b.example/atom");
        Path opml = tempDir.resolve("out/export.opml");

        int exported = service.exportOpml(opml);

        assertEquals(2, exported);
        String xml = Files.readString(opml, StandardCharsets.UTF_8);
        assertTrue(xml.contains("xmlUrl=\"https://a.example/rss\""), xml);
        assertTrue(xml.contains("xmlUrl=\"https://b.example/atom\""), xml);

        NoosConfig otherConfig = org.mockito.Mockito.mock(NoosConfig.class);
        when(otherConfig.configDir()).thenReturn(tempDir.resolve("other"));
        ChannelListService other = new ChannelListService();
        other.config = otherConfig;
        other.clock = service.clock;

        assertEquals(2, other.importOpml(opml));
        assertEquals(service.listChannels(), other.listChannels());
    }
}
