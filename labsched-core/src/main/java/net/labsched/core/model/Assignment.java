package net.labsched.core.model;

/** A leased pairing handed to the dispatch adapter. {@code host} is null for hostless entries. */
public record Assignment(HostQueueEntry entry, Host host) {
    public boolean hostless() { return host == null; }
}
