package com.watchwise.backend.heartbeat.dto;

public record RecordActivityResponse(boolean success, int relationshipsUpdated) {

    public static RecordActivityResponse failed() {
        return new RecordActivityResponse(false, 0);
    }
}
