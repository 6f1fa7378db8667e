package com.ijp.lifecycle.posting.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class PostingNotFoundException extends RuntimeException {
    private final long postingId;

    public PostingNotFoundException(long postingId) {
        super("Posting " + postingId + " not found");
        this.postingId = postingId;
    }

    public long getPostingId() {
        return postingId;
    }
}
