package com.cw.contentflow.entity;

public enum RecordType {
    TOPIC,
    DRAFT;

    public String bucket() {
        return this == TOPIC ? "topic_pool" : "draft_pool";
    }
}
