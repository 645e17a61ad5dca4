package com.astlens.protocol;

public record OpenSourceFile(String fileUrl) implements HostMessage {

    @Override
    public String type() {
        return OPEN_SOURCE_FILE;
    }
}
