package ca.purps.offlinestorage.worker;

public enum HostState {
    UNINITIALIZED,
    INITIALIZING,
    READY,
    STARTED,
    STOPPED,
    DESTROYED
}
