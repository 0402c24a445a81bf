package io.zipstream.archives;

import io.zipstream.writer.CompressionLevel;

public record ArchiveEntry(String name, byte[] content, CompressionLevel level) { }
