package com.ijp.lifecycle.posting.service;

import com.ijp.lifecycle.posting.model.LifecycleStatus;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class InvalidTransitionException extends RuntimeException {
    private final long postingId;
    private final LifecycleStatus currentStatus;
    private final LifecycleStatus targetStatus;

    public InvalidTransitionException(
        long postingId,
        LifecycleStatus currentStatus,
        LifecycleStatus targetStatus,
        String message
    ) {
        super(message);
        this.postingId = postingId;
        this.currentStatus = currentStatus;
        this.targetStatus = targetStatus;
    }

    public long getPostingId() {
        return postingId;
    }

    public LifecycleStatus getCurrentStatus() {
        return currentStatus;
    }

    public LifecycleStatus getTargetStatus() {
        return targetStatus;
    }
}
