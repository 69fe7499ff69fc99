package ai.pipestream.websub.model;

/**
 * Hub and topic URLs discovered from a resource's link relations.
 *
 * @param hubUrl   the {@code rel="hub"} target
 * @param topicUrl the {@code rel="self"} target
 */
public record DiscoveryResult(String hubUrl, String topicUrl) {
}
