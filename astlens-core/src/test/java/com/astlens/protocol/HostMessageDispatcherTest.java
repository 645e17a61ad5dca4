package com.astlens.protocol;

import com.astlens.ast.SourceRange;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class HostMessageDispatcherTest {

    /**
     * Records navigator calls as strings.
     */
    private static class RecordingNavigator implements HostNavigator {
        final List<String> calls = new ArrayList<>();

        @Override
        public void openSourceFile(URI resource) {
            calls.add("open " + resource);
        }

        @Override
        public void revealRange(URI resource, EditorRange range) {
            calls.add("reveal " + resource + " " + range);
        }
    }

    private final RecordingNavigator navigator = new RecordingNavigator();
    private final HostMessageDispatcher dispatcher = new HostMessageDispatcher(navigator);

    @Test
    void openSourceFileOpensTheResource() {
        assertTrue(dispatcher.dispatch(new OpenSourceFile("file:///a.src")));
        assertEquals(List.of("open file:///a.src"), navigator.calls);
    }

    @Test
    void highlightSelectsZeroBasedSpan() {
        SourceRange range = new SourceRange(8, 8, 8, 18, "file:///b.src");
        assertTrue(dispatcher.dispatch(new HighlightFullDeclaration(range)));
        assertEquals(List.of("reveal file:///b.src " + new EditorRange(7, 7, 7, 17)), navigator.calls);
    }

    @Test
    void editorRangeShiftsEveryCoordinate() {
        assertEquals(new EditorRange(0, 0, 2, 4),
            EditorRange.fromSourceRange(new SourceRange(1, 1, 3, 5, "file:///x")));
    }

    @Test
    void invalidUrlIsDropped() {
        assertFalse(dispatcher.dispatch(new OpenSourceFile("not a uri")));
        assertFalse(dispatcher.dispatch(new OpenSourceFile(null)));
        assertTrue(navigator.calls.isEmpty());
    }

    @Test
    void highlightWithoutRangeIsDropped() {
        assertFalse(assertDoesNotThrow(() -> dispatcher.dispatch(new HighlightFullDeclaration(null))));
        assertTrue(navigator.calls.isEmpty());
    }

    @Test
    void queuedMessagesReachTheHostInOrder() throws InterruptedException {
        QueueHostChannel channel = new QueueHostChannel();
        channel.post(new OpenSourceFile("file:///a.src"));
        channel.post(new HighlightFullDeclaration(new SourceRange(1, 1, 1, 2, "file:///a.src")));

        HostMessage first = channel.poll(1, TimeUnit.SECONDS);
        assertEquals(HostMessage.OPEN_SOURCE_FILE, first.type());
        dispatcher.dispatch(first);
        for (HostMessage message : channel.drain()) {
            dispatcher.post(message);
        }

        assertTrue(channel.isEmpty());
        assertEquals(List.of("open file:///a.src", "reveal file:///a.src " + new EditorRange(0, 0, 0, 1)),
            navigator.calls);
    }
}
