/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.noos.commands;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import villagecompute.noos.exceptions.DuplicateResourceException;
import villagecompute.noos.services.ChannelListService;

/**
 * Unit tests for the {@code feed} command handlers.
 */
class FeedCommandHandlersTest {

    @Mock
    ChannelListService channelListService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void testFeedList_printsOneUrlPerLine() {
        when(channelListService.listChannels()).thenReturn(List.of("https://a.example/rss", "https://b.example/rss"));
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        FeedListCommandHandler handler = new FeedListCommandHandler();
        handler.channelListService = channelListService;
        handler.out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

        assertEquals(CommandHandler.EXIT_OK, handler.execute(List.of()));
        assertEquals("https://a.example/rss" + System.lineSeparator() + "https://b.example/rss"
                + System.lineSeparator(), buffer.toString(StandardCharsets.UTF_8));
    }

    @Test
    void testFeedAdd_delegates() {
        FeedAddCommandHandler handler = new FeedAddCommandHandler();
        handler.channelListService = channelListService;

        assertEquals(CommandType.FEED_ADD, handler.handlesType());
        assertEquals(CommandHandler.EXIT_OK, handler.execute(List.of("https://a.example/rss")));
        verify(channelListService).addChannel("https://a.example/rss");
    }

    @Test
    void testFeedAdd_duplicatePropagates() {
        doThrow(new DuplicateResourceException("dup")).when(channelListService).addChannel("https://a.example/rss");
        FeedAddCommandHandler handler = new FeedAddCommandHandler();
        handler.channelListService = channelListService;

        assertThrows(DuplicateResourceException.class, () -> handler.execute(List.of("https://a.example/rss")));
    }

    @Test
    void testFeedRemove_delegates() {
        FeedRemoveCommandHandler handler = new FeedRemoveCommandHandler();
        handler.channelListService = channelListService;

        handler.execute(List.of("https://a.example/rss"));

        verify(channelListService).removeChannel("https://a.example/rss");
    }

    @Test
    void testFeedImportAndExport_delegateWithPaths() {
        FeedImportCommandHandler importer = new FeedImportCommandHandler();
        importer.channelListService = channelListService;
        FeedExportCommandHandler exporter = new FeedExportCommandHandler();
        exporter.channelListService = channelListService;

        importer.execute(List.of("in.opml"));
        exporter.execute(List.of("out.opml"));

        verify(channelListService).importOpml(Path.of("in.opml"));
        verify(channelListService).exportOpml(Path.of("out.opml"));
    }
}
