package com.company.outages.cache;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

@Component
@ConditionalOnProperty(
        value = "outages.snapshot.store",
        havingValue = "memory",
        matchIfMissing = true
)
public class InMemoryOutageSnapshotCache implements OutageSnapshotCache {

    private final AtomicReference<OutageSnapshot> current = new AtomicReference<>();

    @Override
    public Optional<OutageSnapshot> get() {
        return Optional.ofNullable(current.get());
    }

    @Override
    public void store(OutageSnapshot snapshot) {
        current.set(snapshot);
    }
}
