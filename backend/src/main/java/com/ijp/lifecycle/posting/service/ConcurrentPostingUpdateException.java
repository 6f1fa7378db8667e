package com.ijp.lifecycle.posting.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The posting changed between read and write. Callers outside the sweeper should reload and
 * decide again.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class ConcurrentPostingUpdateException extends RuntimeException {
    private final long postingId;

    public ConcurrentPostingUpdateException(long postingId) {
        super("Posting " + postingId + " was modified concurrently; reload and retry");
        this.postingId = postingId;
    }

    public long getPostingId() {
        return postingId;
    }
}
