package io.zipstream.archives;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class EntryTooLargeException extends ResponseStatusException {

    public EntryTooLargeException(String entryName, long maxEntrySize) {
        super(HttpStatus.PAYLOAD_TOO_LARGE, "Entry '" + entryName + "' exceeds the limit of " + maxEntrySize + " bytes");
    }
}
