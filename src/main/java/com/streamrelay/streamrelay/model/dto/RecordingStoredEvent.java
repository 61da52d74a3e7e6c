package com.streamrelay.streamrelay.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

// Kafka message announcing a persisted recording
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class RecordingStoredEvent {
    private String streamKey;
    private String fileName;
    private long fileSize;
    private Double durationSeconds;
    private String url;
    private String location;
    private String uploadTime;
}
