package com.streamrelay.streamrelay.service.recording;

import com.streamrelay.streamrelay.config.RecordingProperties;
import com.streamrelay.streamrelay.model.RecordingDetails;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FFmpegRecordingProbeTest {

    @Test
    void testProbe_DisabledReturnsNoDetails() {
        RecordingProperties properties = new RecordingProperties();
        properties.getProbe().setEnabled(false);

        RecordingDetails details = new FFmpegRecordingProbe(properties).probe(Path.of("missing.flv"));

        assertSame(RecordingDetails.NONE, details);
    }
}
