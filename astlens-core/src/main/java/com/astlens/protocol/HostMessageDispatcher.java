package com.astlens.protocol;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Host-side consumer of {@link HostMessage}s: turns each message into a {@link HostNavigator} call.
 *
 * Messages without a range or naming a file URL that is not a valid URI are logged and dropped.
 */
public class HostMessageDispatcher implements HostChannel {

    private static final Logger log = LoggerFactory.getLogger(HostMessageDispatcher.class);

    private final HostNavigator navigator;

    public HostMessageDispatcher(HostNavigator navigator) {
        this.navigator = navigator;
    }

    @Override
    public void post(HostMessage message) {
        dispatch(message);
    }

    /**
     * Handles one message.
     *
     * @return true if the navigator was invoked
     */
    public boolean dispatch(HostMessage message) {
        if (message instanceof OpenSourceFile open) {
            log.debug("openSourceFile {}", open.fileUrl());
            URI resource = toUri(open.fileUrl());
            if (resource == null) {
                return false;
            }
            navigator.openSourceFile(resource);
            return true;
        } else if (message instanceof HighlightFullDeclaration highlight) {
            log.debug("highlightFullDeclaration {}", highlight.range());
            if (highlight.range() == null) {
                log.warn("highlightFullDeclaration without range ignored");
                return false;
            }
            URI resource = toUri(highlight.range().fileUrl());
            if (resource == null) {
                return false;
            }
            navigator.revealRange(resource, EditorRange.fromSourceRange(highlight.range()));
            return true;
        }
        throw new IllegalArgumentException("Unsupported message type: " + message.type());
    }

    private static URI toUri(String fileUrl) {
        if (fileUrl == null) {
            log.warn("Message without file URL ignored");
            return null;
        }
        try {
            return new URI(fileUrl);
        } catch (URISyntaxException e) {
            log.warn("Ignoring message with invalid file URL '{}': {}", fileUrl, e.getMessage());
            return null;
        }
    }
}
