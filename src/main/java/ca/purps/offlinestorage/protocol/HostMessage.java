package ca.purps.offlinestorage.protocol;

/**
 * Messages written by the host to the worker's standard input.
 */
public sealed interface HostMessage permits InitMessage, WorkerCommand {
}
