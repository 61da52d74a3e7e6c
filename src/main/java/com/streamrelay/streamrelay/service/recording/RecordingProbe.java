package com.streamrelay.streamrelay.service.recording;

import com.streamrelay.streamrelay.model.RecordingDetails;

import java.nio.file.Path;

/**
 * Extracts optional details (duration, quality, thumbnail) from a finished capture.
 * Implementations never throw; a capture that cannot be read yields {@link RecordingDetails#NONE}.
 */
public interface RecordingProbe {

    RecordingDetails probe(Path capture);
}
