package com.blueprintbridge.transpiler.emit;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Engine events that map to virtual overrides on the parent class. */
public final class EventSignatures {

    /** An override: C++ method name and its fixed parameter list. */
    public record EventSignature(String methodName, List<MethodSignature.Param> params) {
        public String superCall() {
            StringBuilder sb = new StringBuilder("Super::").append(methodName).append('(');
            for (int i = 0; i < params.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(params.get(i).name());
            }
            return sb.append(");").toString();
        }
    }

    private static final Map<String, EventSignature> BY_MEMBER = new HashMap<>();

    static {
        register(new EventSignature("BeginPlay", List.of()), "BeginPlay", "ReceiveBeginPlay");
        register(new EventSignature("Tick", List.of(new MethodSignature.Param("float", "DeltaTime", null))),
                "Tick", "ReceiveTick");
        register(new EventSignature("EndPlay",
                        List.of(new MethodSignature.Param("const EEndPlayReason::Type", "EndPlayReason", null))),
                "EndPlay", "ReceiveEndPlay");
        register(new EventSignature("NotifyActorBeginOverlap",
                        List.of(new MethodSignature.Param("AActor*", "OtherActor", null))),
                "NotifyActorBeginOverlap", "ReceiveActorBeginOverlap", "ActorBeginOverlap");
        register(new EventSignature("NotifyActorEndOverlap",
                        List.of(new MethodSignature.Param("AActor*", "OtherActor", null))),
                "NotifyActorEndOverlap", "ReceiveActorEndOverlap", "ActorEndOverlap");
        register(new EventSignature("Destroyed", List.of()), "Destroyed", "ReceiveDestroyed");
    }

    private EventSignatures() {}

    private static void register(EventSignature signature, String... members) {
        for (String member : members) {
            BY_MEMBER.put(member, signature);
        }
    }

    public static Optional<EventSignature> lookup(String member) {
        return Optional.ofNullable(member == null ? null : BY_MEMBER.get(member));
    }
}
