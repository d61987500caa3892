package io.csvchange.monitor;

import java.time.Instant;

/** Last observed state of a watched file; {@code digest} is null unless checksum strictness is on. */
public record FileBaseline(long size, Instant modifiedAt, String digest) {
}
