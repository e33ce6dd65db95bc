package io.meshview.model;

public enum CacheState {
    EMPTY,
    FRESH,
    STALE,
    REFRESHING
}
