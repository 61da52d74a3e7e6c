package com.streamrelay.streamrelay.service.egress;

import com.streamrelay.streamrelay.exception.PlatformApiException;

/**
 * Starts and stops derived-output jobs on the media platform.
 */
public interface EgressClient {

    /**
     * Starts one job composing the given audio and video tracks into a single output stream.
     *
     * @return the job id
     * @throws PlatformApiException if the job could not be started
     */
    String startTrackComposite(String room, String audioTrackId, String videoTrackId);

    /**
     * @throws PlatformApiException if the stop call failed
     */
    void stopEgress(String egressId);
}
