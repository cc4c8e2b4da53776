package com.company.outages.domain;

import lombok.Value;

import java.time.Instant;

@Value
public class LinkLastSeen {
    String linkPk;
    Instant lastSeen;
}
