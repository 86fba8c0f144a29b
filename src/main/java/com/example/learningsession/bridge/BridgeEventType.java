package com.example.learningsession.bridge;

public enum BridgeEventType {
    // ledger feed, payload {sequenceNumber, message}
    MESSAGE_APPENDED,
    MESSAGE_TRANSITIONED,

    PLAYBACK_SUSPENDED,
    PLAYBACK_RESUME_SCHEDULED,
    PLAYBACK_RESUMED,

    ACTIVITY_COMPLETED,
    ACTIVITY_PURGED,

    // cache feed, payload {cacheKey, snapshot}
    CACHE_UPDATED,

    SESSION_CLOSED,

    // content notifications from upload and editing workers, passed through as is
    UPLOAD_PROGRESS,
    UPLOAD_COMPLETE,
    VIDEO_UPDATE_COMPLETE,
    CHAPTER_UPDATE_COMPLETE
}
