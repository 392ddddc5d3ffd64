package in.assignhub.transport.ws;

/**
 * Outcome of one fan-out.
 *
 * @param candidates connections in the snapshot
 * @param matched    connections whose filters matched
 * @param queued     frames accepted for delivery
 * @param failed     matched connections dropped instead (closed or backlog full)
 */
public record DispatchReport(int candidates, int matched, int queued, int failed) {
}
