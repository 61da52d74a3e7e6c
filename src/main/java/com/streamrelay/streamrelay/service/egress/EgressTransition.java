package com.streamrelay.streamrelay.service.egress;

import lombok.Value;

import java.util.List;

@Value
public class EgressTransition {
    EgressState next;
    List<EgressCommand> commands;

    static EgressTransition to(EgressState next, EgressCommand... commands) {
        return new EgressTransition(next, List.of(commands));
    }

    static EgressTransition unchanged(EgressState current) {
        return new EgressTransition(current, List.of());
    }
}
