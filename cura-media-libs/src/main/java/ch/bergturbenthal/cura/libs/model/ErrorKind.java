package ch.bergturbenthal.cura.libs.model;

import lombok.Getter;

public enum ErrorKind {
    UNREADABLE_FILE("UnreadableFile", "Unable to access the file or folder. Please check permissions."),
    UNSUPPORTED_FORMAT("UnsupportedFormat", "This file type is not supported."),
    DECODE_FAILURE("DecodeFailure", "The file appears to be corrupted or invalid."),
    NO_VIDEO_STREAM("NoVideoStream", "The file does not contain any video."),
    UNSUPPORTED_CODEC("UnsupportedCodec", "The video format of this file is not supported."),
    EXTERNAL_TOOL_UNAVAILABLE("ExternalToolUnavailable",
            "Video support is not available. Please install FFmpeg to enable video thumbnails."),
    CACHE_WRITE_FAILURE("CacheWriteFailure", "Not enough disk space available or the cache folder is not writable.");

    @Getter
    private final String label;
    @Getter
    private final String userMessage;

    ErrorKind(final String label, final String userMessage) {
        this.label = label;
        this.userMessage = userMessage;
    }
}
