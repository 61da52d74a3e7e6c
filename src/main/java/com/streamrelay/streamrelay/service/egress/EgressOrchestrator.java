package com.streamrelay.streamrelay.service.egress;

import com.streamrelay.streamrelay.config.EgressProperties;
import com.streamrelay.streamrelay.model.dto.ParticipantInfo;
import com.streamrelay.streamrelay.model.dto.TrackType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps at most one composite egress job per room, started once the room's publisher exposes an
 * audio and a video track and stopped once when the room's ingress ends.
 *
 * <p>Each event is applied to the room's state in a single atomic map step through
 * {@link EgressStateMachine}; the external calls it yields run afterwards on the
 * {@link EgressTaskScheduler} and report back as further events. A lookup or start that completes
 * after the room moved on is therefore re-validated instead of trusted.
 */
@Service
public class EgressOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(EgressOrchestrator.class);

    private final Map<String, EgressState> rooms = new ConcurrentHashMap<>();
    private final AtomicLong tokens = new AtomicLong();

    private final EgressStateMachine stateMachine;
    private final ParticipantDirectory participantDirectory;
    private final EgressClient egressClient;
    private final EgressTaskScheduler scheduler;

    @Autowired
    public EgressOrchestrator(ParticipantDirectory participantDirectory,
                              EgressClient egressClient,
                              EgressTaskScheduler scheduler,
                              EgressProperties properties) {
        this(new EgressStateMachine(properties.getResolveAttempts(), properties.getResolveRetryDelayMs()),
                participantDirectory, egressClient, scheduler);
        if (properties.isEnabled() && properties.getStreamUrls().isEmpty()) {
            logger.warn("egress.stream-urls is empty; egress starts will fail until an output URL is configured");
        }
    }

    public EgressOrchestrator(EgressStateMachine stateMachine,
                              ParticipantDirectory participantDirectory,
                              EgressClient egressClient,
                              EgressTaskScheduler scheduler) {
        this.stateMachine = stateMachine;
        this.participantDirectory = participantDirectory;
        this.egressClient = egressClient;
        this.scheduler = scheduler;
    }

    public void onTrackPublished(String room, TrackType trackType) {
        if (trackType == TrackType.VIDEO) {
            apply(room, EgressEvent.videoTrackPublished(tokens.incrementAndGet()));
        } else {
            logger.debug("Ignoring {} track published in room {}", trackType, room);
            apply(room, EgressEvent.audioTrackPublished());
        }
    }

    public void onIngressEnded(String room) {
        apply(room, EgressEvent.ingressEnded());
    }

    /** Current state of a room; idle rooms are not stored. */
    EgressState stateOf(String room) {
        return rooms.getOrDefault(room, EgressState.IDLE);
    }

    private void apply(String room, EgressEvent event) {
        List<EgressCommand> commands = new ArrayList<>();
        EgressState[] before = new EgressState[1];

        EgressState after = rooms.compute(room, (key, current) -> {
            before[0] = current == null ? EgressState.IDLE : current;
            EgressTransition transition = stateMachine.transition(key, current, event);
            commands.addAll(transition.getCommands());
            return transition.getNext().isIdle() ? null : transition.getNext();
        });

        EgressPhase from = before[0].getPhase();
        EgressPhase to = after == null ? EgressPhase.IDLE : after.getPhase();
        if (from != to) {
            logger.info("Egress room={} {} -> {} on {}", room, from, to, event.getType());
        }
        if (event.getType() == EgressEvent.Type.TRACKS_UNRESOLVED && from == EgressPhase.TRACK_PENDING
                && to == EgressPhase.IDLE) {
            logger.warn("Egress start abandoned for room {}: tracks still incomplete after {} lookups",
                    room, stateMachine.getMaxResolveAttempts());
        }

        commands.forEach(this::execute);
    }

    private void execute(EgressCommand command) {
        switch (command.getType()) {
            case RESOLVE_TRACKS:
                scheduler.schedule(() -> resolveTracks(command.getRoom(), command.getToken()),
                        command.getDelayMillis());
                break;
            case START_EGRESS:
                scheduler.schedule(() -> startEgress(command), 0L);
                break;
            case STOP_EGRESS:
                scheduler.schedule(() -> stopEgress(command.getRoom(), command.getEgressId()), 0L);
                break;
            default:
                logger.warn("Unhandled egress command {}", command.getType());
        }
    }

    private void resolveTracks(String room, long token) {
        Optional<String[]> tracks;
        try {
            tracks = findPublisherTracks(participantDirectory.listParticipants(room));
        } catch (RuntimeException e) {
            logger.warn("Participant lookup failed for room {}: {}", room, e.getMessage());
            tracks = Optional.empty();
        }

        if (tracks.isPresent()) {
            apply(room, EgressEvent.tracksResolved(token, tracks.get()[0], tracks.get()[1]));
        } else {
            logger.info("No publisher with audio and video tracks in room {} yet", room);
            apply(room, EgressEvent.tracksUnresolved(token));
        }
    }

    /**
     * @return audio and video track ids of the first participant exposing both
     */
    private static Optional<String[]> findPublisherTracks(List<ParticipantInfo> participants) {
        if (participants == null) {
            return Optional.empty();
        }
        for (ParticipantInfo participant : participants) {
            Optional<String> audio = participant.firstTrackSid(TrackType.AUDIO);
            Optional<String> video = participant.firstTrackSid(TrackType.VIDEO);
            if (audio.isPresent() && video.isPresent()) {
                return Optional.of(new String[] {audio.get(), video.get()});
            }
        }
        return Optional.empty();
    }

    private void startEgress(EgressCommand command) {
        String room = command.getRoom();
        String egressId;
        try {
            egressId = egressClient.startTrackComposite(room, command.getAudioTrackId(), command.getVideoTrackId());
        } catch (RuntimeException e) {
            logger.error("Failed to start egress for room {}: {}", room, e.getMessage());
            apply(room, EgressEvent.egressStartFailed(command.getToken()));
            return;
        }
        logger.info("Egress {} started for room {} (audio={}, video={})",
                egressId, room, command.getAudioTrackId(), command.getVideoTrackId());
        apply(room, EgressEvent.egressStarted(command.getToken(), egressId));
    }

    private void stopEgress(String room, String egressId) {
        try {
            egressClient.stopEgress(egressId);
            logger.info("Egress {} stopped for room {}", egressId, room);
        } catch (RuntimeException e) {
            logger.error("Failed to stop egress {} for room {}: {}", egressId, room, e.getMessage());
        }
    }
}
